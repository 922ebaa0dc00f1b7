package com.gomoku.tableservice.games.gomoku.domain.rule;

import com.gomoku.tableservice.games.gomoku.domain.model.Board;
import com.gomoku.tableservice.games.gomoku.domain.model.Role;

import java.util.Optional;

/** 对局结果：进行中 / 黑胜 / 白胜 / 和棋。每次落子后由棋盘重新推导，不单独存储。 */
public enum Outcome {
    /** 对局进行中（尚未分出胜负） */
    IN_PROGRESS,
    /** 黑方胜利 */
    BLACK_WIN,
    /** 白方胜利 */
    WHITE_WIN,
    /** 平局（棋盘下满且无人成五） */
    DRAW;

    /** 胜方对应的结果 */
    public static Outcome winOf(Role role) {
        return role == Role.BLACK ? BLACK_WIN : WHITE_WIN;
    }

    /** 根据当前局面推导结果：先看成五，再看是否下满 */
    public static Outcome of(Board b) {
        Optional<Role> winner = WinDetector.check(b);
        if (winner.isPresent()) {
            return winOf(winner.get());
        }
        return b.isFull() ? DRAW : IN_PROGRESS;
    }

    /** 是否终局 */
    public boolean isTerminal() {
        return this != IN_PROGRESS;
    }

    /** 胜方；进行中与和棋均为 empty */
    public Optional<Role> winner() {
        return switch (this) {
            case BLACK_WIN -> Optional.of(Role.BLACK);
            case WHITE_WIN -> Optional.of(Role.WHITE);
            default -> Optional.empty();
        };
    }
}
