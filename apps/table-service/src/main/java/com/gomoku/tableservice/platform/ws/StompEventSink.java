package com.gomoku.tableservice.platform.ws;

import com.gomoku.tableservice.games.gomoku.application.channel.EventSink;
import com.gomoku.tableservice.games.gomoku.application.event.EventType;
import com.gomoku.tableservice.games.gomoku.application.event.TableEvent;
import com.gomoku.tableservice.platform.config.GomokuProperties;
import com.gomoku.tableservice.platform.transport.Envelope;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.messaging.simp.SimpMessageType;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 把牌桌事件包成 Envelope，点对点推给某个 STOMP 会话。
 * 连接不带登录身份，用 sessionId 当“用户名”，前端订阅 /user/queue/gomoku.events。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StompEventSink implements EventSink {

    public static final String GAME = "gomoku";
    /** 点对点事件目的地 */
    public static final String EVENTS_DESTINATION = "/queue/gomoku.events";

    private final SimpMessagingTemplate messagingTemplate;
    private final GomokuProperties props;

    /** 每个会话一个递增序号 */
    private final ConcurrentMap<String, AtomicLong> seqs = new ConcurrentHashMap<>();

    @Override
    public void send(String sessionId, TableEvent event) {
        long seq = seqs.computeIfAbsent(sessionId, k -> new AtomicLong()).incrementAndGet();
        Envelope<Object> env = Envelope.of(kindOf(event.getType()), GAME, props.getTableId(),
                event.getType().name(), event.getPayload(), seq);

        SimpMessageHeaderAccessor headerAccessor = SimpMessageHeaderAccessor.create(SimpMessageType.MESSAGE);
        headerAccessor.setSessionId(sessionId);
        headerAccessor.setLeaveMutable(true);
        messagingTemplate.convertAndSendToUser(sessionId, EVENTS_DESTINATION, env, headerAccessor.getMessageHeaders());
        log.trace("已推送: session={}, type={}, seq={}", sessionId, event.getType(), seq);
    }

    /** 会话结束后清理序号 */
    public void forget(String sessionId) {
        seqs.remove(sessionId);
    }

    static Envelope.Kind kindOf(EventType type) {
        return switch (type) {
            case BOARD_STATE -> Envelope.Kind.STATE;
            case ERROR, JOIN_REJECTED -> Envelope.Kind.ERROR;
            default -> Envelope.Kind.EVENT;
        };
    }
}
