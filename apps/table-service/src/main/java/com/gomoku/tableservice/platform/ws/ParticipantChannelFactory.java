package com.gomoku.tableservice.platform.ws;

import com.gomoku.tableservice.games.gomoku.application.channel.ParticipantChannel;
import com.gomoku.tableservice.games.gomoku.application.channel.QueuedParticipantChannel;
import com.gomoku.tableservice.platform.config.GomokuProperties;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.concurrent.ExecutorService;

/**
 * 为 STOMP 会话创建出站通道（有界队列 + 独立投递任务）。
 */
@Component
public class ParticipantChannelFactory {

    private final StompEventSink sink;
    private final GomokuProperties props;
    private final ExecutorService executor;

    public ParticipantChannelFactory(StompEventSink sink, GomokuProperties props,
                                     @Qualifier("eventDeliveryExecutor") ExecutorService executor) {
        this.sink = sink;
        this.props = props;
        this.executor = executor;
    }

    public ParticipantChannel open(String sessionId) {
        return QueuedParticipantChannel.open(sessionId, props.getChannel().getCapacity(), sink, executor);
    }
}
