package com.gomoku.tableservice.games.gomoku.application.event;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.gomoku.tableservice.games.gomoku.domain.model.Board;
import com.gomoku.tableservice.games.gomoku.domain.model.Move;
import com.gomoku.tableservice.games.gomoku.domain.model.Role;
import com.gomoku.tableservice.games.gomoku.domain.rule.Outcome;
import lombok.Getter;

import java.util.Objects;

/**
 * 牌桌事件：type + 强类型载荷。
 * 不可变，同一个实例会被投递给多个参与者。
 */
@Getter
public final class TableEvent {

    private final EventType type;
    private final Object payload;

    private TableEvent(EventType type, Object payload) {
        this.type = Objects.requireNonNull(type, "type");
        this.payload = payload;
    }

    /** 按类型取载荷（类型不符抛 ClassCastException） */
    public <T> T payload(Class<T> clazz) {
        return clazz.cast(payload);
    }

    @Override
    public String toString() {
        return "TableEvent{" + type + ", " + payload + '}';
    }

    // ========== 工厂 ==========

    public static TableEvent joinAccepted(Role role) {
        return new TableEvent(EventType.JOIN_ACCEPTED, new RolePayload(role));
    }

    public static TableEvent joinRejected(String code, String reason) {
        return new TableEvent(EventType.JOIN_REJECTED, new JoinRejected(code, reason));
    }

    public static TableEvent moveApplied(Move move, Role role) {
        return new TableEvent(EventType.MOVE_APPLIED, new MoveApplied(move.row(), move.col(), role));
    }

    public static TableEvent boardState(Board board) {
        return new TableEvent(EventType.BOARD_STATE, new BoardState(board.rows(), board.currentTurn()));
    }

    public static TableEvent turn(Role role) {
        return new TableEvent(EventType.TURN, new RolePayload(role));
    }

    public static TableEvent participantJoined(Role role, String displayName) {
        return new TableEvent(EventType.PARTICIPANT_JOINED, new ParticipantJoined(role, displayName));
    }

    public static TableEvent participantLeft(Role role) {
        return new TableEvent(EventType.PARTICIPANT_LEFT, new RolePayload(role));
    }

    public static TableEvent gameOver(Outcome outcome) {
        return new TableEvent(EventType.GAME_OVER, new GameOver(outcome, outcome.winner().orElse(null)));
    }

    public static TableEvent error(String code, String message) {
        return new TableEvent(EventType.ERROR, new ErrorPayload(code, message));
    }

    public static TableEvent serverShutdown() {
        return new TableEvent(EventType.SERVER_SHUTDOWN, null);
    }

    // ========== 载荷 ==========

    public record RolePayload(Role role) { }

    public record JoinRejected(String code, String reason) { }

    public record MoveApplied(int row, int col, Role role) { }

    /** grid：15 行字符串，'X' 黑 / 'O' 白 / '.' 空 */
    public record BoardState(String[] grid, Role currentTurn) { }

    public record ParticipantJoined(Role role, String displayName) { }

    /** 和棋时 winner 为 null（序列化时省略） */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record GameOver(Outcome outcome, Role winner) { }

    public record ErrorPayload(String code, String message) { }
}
