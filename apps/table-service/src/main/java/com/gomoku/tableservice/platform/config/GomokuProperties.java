package com.gomoku.tableservice.platform.config;

import com.gomoku.tableservice.games.gomoku.domain.ai.SearchEngine;
import com.gomoku.tableservice.games.gomoku.domain.ai.SearchStrategy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * 牌桌相关配置（application.yml 中 gomoku.* ，可用环境变量覆盖）。
 */
@Data
@Component
@ConfigurationProperties(prefix = "gomoku")
public class GomokuProperties {

    /** 牌桌标识（单桌部署，只用于日志和消息外壳） */
    private String tableId = "main";

    /** 关服时等待事件队列排空的时间（毫秒） */
    private long shutdownDrainMs = 200;

    private Ai ai = new Ai();

    private Channel channel = new Channel();

    @Data
    public static class Ai {
        /** 只有一名真人时是否由 AI 补位 */
        private boolean enabled = true;
        /** 搜索深度 */
        private int depth = SearchEngine.DEFAULT_DEPTH;
        /** 每层递归展开的应手数 */
        private int replyWidth = SearchEngine.DEFAULT_REPLY_WIDTH;
        private SearchStrategy strategy = SearchStrategy.HEURISTIC;
        /** 随机种子，仅 RANDOM 策略使用；为空则不固定 */
        private Long seed;
    }

    @Data
    public static class Channel {
        /** 每个参与者的出站队列容量，满了直接丢弃新事件 */
        private int capacity = 32;
    }
}
