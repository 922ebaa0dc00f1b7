package com.gomoku.tableservice.games.gomoku.domain.exception;

import lombok.Getter;

/**
 * 对局业务异常：携带错误码，消息为用户可见文案（见 GameMessages）。
 * 协调器会把它转成 ERROR 事件只推给发起方，同时继续抛给调用方。
 */
@Getter
public class GameException extends RuntimeException {

    private final GameErrorCode code;

    public GameException(GameErrorCode code, String message) {
        super(message);
        this.code = code;
    }
}
