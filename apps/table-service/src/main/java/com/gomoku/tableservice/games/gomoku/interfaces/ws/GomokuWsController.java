package com.gomoku.tableservice.games.gomoku.interfaces.ws;

import com.gomoku.tableservice.games.gomoku.application.SessionCoordinator;
import com.gomoku.tableservice.games.gomoku.application.channel.ParticipantChannel;
import com.gomoku.tableservice.games.gomoku.application.event.TableEvent;
import com.gomoku.tableservice.games.gomoku.domain.constants.GameMessages;
import com.gomoku.tableservice.games.gomoku.domain.exception.GameErrorCode;
import com.gomoku.tableservice.games.gomoku.domain.exception.GameException;
import com.gomoku.tableservice.games.gomoku.domain.model.Move;
import com.gomoku.tableservice.games.gomoku.domain.model.Role;
import com.gomoku.tableservice.games.gomoku.interfaces.ws.dto.GomokuMessages.JoinCmd;
import com.gomoku.tableservice.games.gomoku.interfaces.ws.dto.GomokuMessages.MoveCmd;
import com.gomoku.tableservice.games.gomoku.interfaces.ws.dto.GomokuMessages.SimpleCmd;
import com.gomoku.tableservice.platform.ws.ParticipantChannelFactory;
import com.gomoku.tableservice.platform.ws.StompEventSink;
import com.gomoku.tableservice.platform.ws.WebSocketSessionManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.converter.MessageConversionException;
import org.springframework.messaging.handler.annotation.MessageExceptionHandler;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.stereotype.Controller;

import java.util.Optional;

/**
 * Gomoku WebSocket 控制器
 * ----------------------------------------
 * 接收前端通过 STOMP 发送的指令，转给 SessionCoordinator：
 *   1. /app/gomoku.join    入座
 *   2. /app/gomoku.move    落子（AI 应手在同一次调用内完成）
 *   3. /app/gomoku.restart 本盘结束后重开
 *
 * 协调器会把业务错误推给发起方，这里只处理协调器之外的错误（未入座、消息格式不对）。
 */
@Controller
@RequiredArgsConstructor
@Slf4j
public class GomokuWsController {

    /** 传输层错误码（不属于对局错误） */
    static final String MALFORMED_MESSAGE = "MALFORMED_MESSAGE";
    static final String ALREADY_JOINED = "ALREADY_JOINED";

    private final SessionCoordinator coordinator;
    private final WebSocketSessionManager sessions;
    private final ParticipantChannelFactory channelFactory;
    private final StompEventSink sink;

    @MessageMapping("/gomoku.join")
    public void join(JoinCmd cmd, SimpMessageHeaderAccessor sha) {
        String sessionId = sha.getSessionId();
        if (!sessions.reserve(sessionId)) {
            sink.send(sessionId, TableEvent.error(ALREADY_JOINED, GameMessages.ALREADY_JOINED));
            return;
        }
        ParticipantChannel channel = channelFactory.open(sessionId);
        Role role;
        try {
            role = coordinator.join(cmd == null ? null : cmd.getDisplayName(), channel);
        } catch (GameException e) {
            // JOIN_REJECTED 已由协调器放进通道，关闭后投递任务会把它送完
            log.info("入座被拒: session={}, code={}", sessionId, e.getCode());
            sessions.release(sessionId);
            channel.close();
            return;
        }
        sessions.complete(sessionId, role, channel);
    }

    @MessageMapping("/gomoku.move")
    public void move(MoveCmd cmd, SimpMessageHeaderAccessor sha) {
        String sessionId = sha.getSessionId();
        Optional<Role> role = seatedRole(sessionId);
        if (role.isEmpty()) return;
        if (cmd == null || cmd.getRow() == null || cmd.getCol() == null) {
            sink.send(sessionId, TableEvent.error(MALFORMED_MESSAGE, GameMessages.MISSING_COORDINATES));
            return;
        }
        try {
            coordinator.submitMove(role.get(), new Move(cmd.getRow(), cmd.getCol()));
        } catch (GameException e) {
            log.debug("落子失败: session={}, code={}, msg={}", sessionId, e.getCode(), e.getMessage());
        }
    }

    @MessageMapping("/gomoku.restart")
    public void restart(SimpleCmd cmd, SimpMessageHeaderAccessor sha) {
        String sessionId = sha.getSessionId();
        Optional<Role> role = seatedRole(sessionId);
        if (role.isEmpty()) return;
        try {
            coordinator.restart(role.get());
        } catch (GameException e) {
            log.debug("重开失败: session={}, code={}", sessionId, e.getCode());
        }
    }

    /** 入站消息无法反序列化：直接回 ERROR，不进入协调器 */
    @MessageExceptionHandler(MessageConversionException.class)
    public void handleMalformed(MessageConversionException e, SimpMessageHeaderAccessor sha) {
        log.warn("无法解析的入站消息: session={}, dest={}", sha.getSessionId(), sha.getDestination(), e);
        sink.send(sha.getSessionId(), TableEvent.error(MALFORMED_MESSAGE, GameMessages.MALFORMED_MESSAGE));
    }

    private Optional<Role> seatedRole(String sessionId) {
        Optional<Role> role = sessions.roleOf(sessionId);
        if (role.isEmpty()) {
            sink.send(sessionId, TableEvent.error(GameErrorCode.NOT_SEATED.name(), GameMessages.NOT_SEATED));
        }
        return role;
    }
}
