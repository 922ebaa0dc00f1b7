package com.gomoku.tableservice.platform.config;

import com.gomoku.tableservice.games.gomoku.application.SessionCoordinator;
import com.gomoku.tableservice.games.gomoku.domain.ai.SearchEngine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Random;

/**
 * 装配 AI 与牌桌协调器（单桌，进程内唯一实例）。
 */
@Slf4j
@Configuration
public class GomokuTableConfig {

    @Bean
    public SearchEngine searchEngine(GomokuProperties props) {
        GomokuProperties.Ai ai = props.getAi();
        Random random = ai.getSeed() == null ? new Random() : new Random(ai.getSeed());
        log.info("AI 配置: strategy={}, depth={}, replyWidth={}", ai.getStrategy(), ai.getDepth(), ai.getReplyWidth());
        return new SearchEngine(ai.getDepth(), ai.getReplyWidth(), ai.getStrategy(), random);
    }

    @Bean
    public SessionCoordinator sessionCoordinator(GomokuProperties props, SearchEngine searchEngine) {
        return new SessionCoordinator(props.getTableId(), searchEngine, props.getAi().isEnabled());
    }
}
