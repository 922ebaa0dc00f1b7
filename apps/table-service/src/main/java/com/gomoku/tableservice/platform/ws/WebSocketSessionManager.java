package com.gomoku.tableservice.platform.ws;

import com.gomoku.tableservice.games.gomoku.application.SessionCoordinator;
import com.gomoku.tableservice.games.gomoku.application.channel.ParticipantChannel;
import com.gomoku.tableservice.games.gomoku.domain.model.Role;
import com.gomoku.tableservice.platform.config.GomokuProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.messaging.SessionDisconnectEvent;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * WebSocket 会话 ↔ 座位 的映射。
 * <p>
 * 职责：
 * - 入座前先占位（reserve），同一会话的并发 join 只有一个能进协调器
 * - 入座成功后把占位换成 sessionId → (role, channel)；占位已被断线清掉则立刻离座并关通道
 * - 连接断开（SessionDisconnectEvent）时让出座位并关闭通道
 * - 应用关闭（ContextClosedEvent）时广播关服通知，给队列一点时间排空
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WebSocketSessionManager {

    private final SessionCoordinator coordinator;
    private final StompEventSink sink;
    private final GomokuProperties props;

    private final Map<String, Connection> connections = new ConcurrentHashMap<>();

    /** 入座中的占位 */
    private static final Connection PENDING = new Connection(null, null);

    /** 已入座的连接；role 为 null 表示还在入座中 */
    public record Connection(Role role, ParticipantChannel channel) { }

    /**
     * 为会话占位。已入座或正在入座的会话返回 false。
     */
    public boolean reserve(String sessionId) {
        return sessionId != null && connections.putIfAbsent(sessionId, PENDING) == null;
    }

    /**
     * 入座成功后登记。占位已不在（连接在入座过程中断开）时，让出刚拿到的座位并关闭通道。
     *
     * @return 是否登记成功
     */
    public boolean complete(String sessionId, Role role, ParticipantChannel channel) {
        if (connections.replace(sessionId, PENDING, new Connection(role, channel))) {
            log.debug("会话登记: session={}, role={}", sessionId, role);
            return true;
        }
        log.info("入座完成前连接已断开，释放座位: session={}, role={}", sessionId, role);
        coordinator.leave(role);
        channel.close();
        return false;
    }

    /** 入座失败：撤销占位 */
    public void release(String sessionId) {
        connections.remove(sessionId, PENDING);
    }

    public Optional<Role> roleOf(String sessionId) {
        Connection c = sessionId == null ? null : connections.get(sessionId);
        return c == null ? Optional.empty() : Optional.ofNullable(c.role());
    }

    public boolean isJoined(String sessionId) {
        return sessionId != null && connections.containsKey(sessionId);
    }

    /**
     * 连接断开：离座 + 关闭通道。未入座的连接只清理序号；入座中的连接由 complete() 收尾。
     */
    @EventListener
    public void handleSessionDisconnect(SessionDisconnectEvent event) {
        String sessionId = event.getSessionId();
        if (sessionId == null) {
            log.warn("收到 SessionDisconnectEvent 但缺少 sessionId");
            return;
        }
        Connection c = connections.remove(sessionId);
        if (c == PENDING) {
            log.info("连接在入座过程中断开: session={}", sessionId);
        } else if (c != null) {
            log.info("连接断开，释放座位: session={}, role={}", sessionId, c.role());
            coordinator.leave(c.role());
            c.channel().close();
        }
        sink.forget(sessionId);
    }

    /**
     * 应用关闭：通知所有参与者，关闭通道，等待投递任务把剩余事件送出。
     */
    @EventListener
    public void handleContextClosed(ContextClosedEvent event) {
        log.info("服务关闭，通知 {} 个在座连接", connections.size());
        coordinator.shutdown();
        connections.values().stream()
                .filter(c -> c.channel() != null)
                .forEach(c -> c.channel().close());
        long drain = props.getShutdownDrainMs();
        if (drain > 0) {
            try {
                Thread.sleep(drain);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("等待事件排空时被中断");
            }
        }
    }
}
