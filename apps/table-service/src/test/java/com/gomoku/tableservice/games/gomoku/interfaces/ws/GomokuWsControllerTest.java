package com.gomoku.tableservice.games.gomoku.interfaces.ws;

import com.gomoku.tableservice.games.gomoku.application.SessionCoordinator;
import com.gomoku.tableservice.games.gomoku.application.channel.ParticipantChannel;
import com.gomoku.tableservice.games.gomoku.application.event.EventType;
import com.gomoku.tableservice.games.gomoku.application.event.TableEvent;
import com.gomoku.tableservice.games.gomoku.domain.constants.GameMessages;
import com.gomoku.tableservice.games.gomoku.domain.exception.GameErrorCode;
import com.gomoku.tableservice.games.gomoku.domain.exception.GameException;
import com.gomoku.tableservice.games.gomoku.domain.model.Move;
import com.gomoku.tableservice.games.gomoku.domain.model.Role;
import com.gomoku.tableservice.games.gomoku.interfaces.ws.dto.GomokuMessages.JoinCmd;
import com.gomoku.tableservice.games.gomoku.interfaces.ws.dto.GomokuMessages.MoveCmd;
import com.gomoku.tableservice.platform.config.GomokuProperties;
import com.gomoku.tableservice.platform.ws.ParticipantChannelFactory;
import com.gomoku.tableservice.platform.ws.StompEventSink;
import com.gomoku.tableservice.platform.ws.WebSocketSessionManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.messaging.converter.MessageConversionException;
import org.springframework.messaging.simp.SimpMessageHeaderAccessor;
import org.springframework.messaging.support.MessageBuilder;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.messaging.SessionDisconnectEvent;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class GomokuWsControllerTest {

    private SessionCoordinator coordinator;
    private WebSocketSessionManager sessions;
    private ParticipantChannelFactory channelFactory;
    private StompEventSink sink;
    private GomokuWsController controller;

    @BeforeEach
    void setUp() {
        coordinator = mock(SessionCoordinator.class);
        sessions = mock(WebSocketSessionManager.class);
        channelFactory = mock(ParticipantChannelFactory.class);
        sink = mock(StompEventSink.class);
        controller = new GomokuWsController(coordinator, sessions, channelFactory, sink);
    }

    private static SimpMessageHeaderAccessor session(String id) {
        SimpMessageHeaderAccessor sha = SimpMessageHeaderAccessor.create();
        sha.setSessionId(id);
        return sha;
    }

    private TableEvent sentError(String sessionId) {
        ArgumentCaptor<TableEvent> captor = ArgumentCaptor.forClass(TableEvent.class);
        verify(sink).send(eq(sessionId), captor.capture());
        assertEquals(EventType.ERROR, captor.getValue().getType());
        return captor.getValue();
    }

    @Test
    void joinRegistersTheSeat() {
        ParticipantChannel ch = mock(ParticipantChannel.class);
        when(sessions.reserve("s1")).thenReturn(true);
        when(channelFactory.open("s1")).thenReturn(ch);
        when(coordinator.join("alice", ch)).thenReturn(Role.BLACK);

        JoinCmd cmd = new JoinCmd();
        cmd.setDisplayName("alice");
        controller.join(cmd, session("s1"));

        verify(sessions).complete("s1", Role.BLACK, ch);
        verify(ch, never()).close();
    }

    @Test
    void rejectedJoinClosesTheChannelAndDropsTheReservation() {
        ParticipantChannel ch = mock(ParticipantChannel.class);
        when(sessions.reserve("s3")).thenReturn(true);
        when(channelFactory.open("s3")).thenReturn(ch);
        when(coordinator.join(any(), eq(ch)))
                .thenThrow(new GameException(GameErrorCode.TABLE_FULL, GameMessages.TABLE_FULL));

        controller.join(new JoinCmd(), session("s3"));

        verify(ch).close();
        verify(sessions).release("s3");
        verify(sessions, never()).complete(any(), any(), any());
    }

    @Test
    void disconnectDuringJoinLeavesNoSeatBehind() {
        WebSocketSessionManager real = new WebSocketSessionManager(coordinator, sink, new GomokuProperties());
        GomokuWsController withRealSessions = new GomokuWsController(coordinator, real, channelFactory, sink);
        ParticipantChannel ch = mock(ParticipantChannel.class);
        when(channelFactory.open("s5")).thenReturn(ch);
        // 协调器分配座位的同时连接断开
        when(coordinator.join(any(), eq(ch))).thenAnswer(inv -> {
            real.handleSessionDisconnect(new SessionDisconnectEvent(new Object(),
                    MessageBuilder.withPayload(new byte[0]).build(), "s5", CloseStatus.GOING_AWAY));
            return Role.WHITE;
        });

        withRealSessions.join(new JoinCmd(), session("s5"));

        verify(coordinator).leave(Role.WHITE);
        verify(ch).close();
        assertFalse(real.isJoined("s5"));
        assertEquals(Optional.empty(), real.roleOf("s5"));
    }

    @Test
    void secondJoinOnSameSessionIsRefused() {
        when(sessions.reserve("s1")).thenReturn(false);

        controller.join(new JoinCmd(), session("s1"));

        assertEquals(GomokuWsController.ALREADY_JOINED,
                sentError("s1").payload(TableEvent.ErrorPayload.class).code());
        verifyNoInteractions(coordinator, channelFactory);
    }

    @Test
    void moveIsForwardedForTheSeatedRole() {
        when(sessions.roleOf("s1")).thenReturn(Optional.of(Role.WHITE));
        MoveCmd cmd = new MoveCmd();
        cmd.setRow(3);
        cmd.setCol(4);

        controller.move(cmd, session("s1"));

        verify(coordinator).submitMove(Role.WHITE, new Move(3, 4));
        verifyNoInteractions(sink);
    }

    @Test
    void moveFromUnseatedSessionGetsNotSeated() {
        when(sessions.roleOf("s9")).thenReturn(Optional.empty());
        MoveCmd cmd = new MoveCmd();
        cmd.setRow(3);
        cmd.setCol(4);

        controller.move(cmd, session("s9"));

        assertEquals(GameErrorCode.NOT_SEATED.name(),
                sentError("s9").payload(TableEvent.ErrorPayload.class).code());
        verifyNoInteractions(coordinator);
    }

    @Test
    void moveWithoutCoordinatesNeverReachesCoordinator() {
        when(sessions.roleOf("s1")).thenReturn(Optional.of(Role.BLACK));
        MoveCmd cmd = new MoveCmd();
        cmd.setRow(3);

        controller.move(cmd, session("s1"));

        assertEquals(GomokuWsController.MALFORMED_MESSAGE,
                sentError("s1").payload(TableEvent.ErrorPayload.class).code());
        verifyNoInteractions(coordinator);
    }

    @Test
    void rejectedMoveIsNotRethrown() {
        when(sessions.roleOf("s1")).thenReturn(Optional.of(Role.BLACK));
        when(coordinator.submitMove(eq(Role.BLACK), any()))
                .thenThrow(new GameException(GameErrorCode.POSITION_OCCUPIED, "taken"));
        MoveCmd cmd = new MoveCmd();
        cmd.setRow(7);
        cmd.setCol(7);

        controller.move(cmd, session("s1"));

        // ERROR 已由协调器推给发起方，这里不重复发送
        verifyNoInteractions(sink);
    }

    @Test
    void malformedFrameGetsError() {
        controller.handleMalformed(new MessageConversionException("bad json"), session("s1"));

        assertEquals(GameMessages.MALFORMED_MESSAGE,
                sentError("s1").payload(TableEvent.ErrorPayload.class).message());
    }
}
