package com.gomoku.tableservice.games.gomoku.domain.exception;

/**
 * 对局错误码。全部可由调用方恢复，不会终止牌桌。
 * clientInput=true 表示请求参数本身有问题（HTTP 映射为 400），其余为状态冲突（409）。
 */
public enum GameErrorCode {
    /** 坐标越界 */
    OUT_OF_BOUNDS(true),
    /** 该点已有棋子 */
    POSITION_OCCUPIED(false),
    /** 未轮到该方 */
    NOT_YOUR_TURN(false),
    /** 两个真人座位都已占用 */
    TABLE_FULL(false),
    /** 行动方不足两方（真人+真人 或 真人+AI） */
    TABLE_NOT_READY(false),
    /** 棋盘已满，无子可下 */
    NO_LEGAL_MOVE(false),
    /** 本盘已结束 */
    GAME_OVER(false),
    /** 本盘尚未结束，不能重开 */
    GAME_IN_PROGRESS(false),
    /** 调用方不是入座的真人玩家 */
    NOT_SEATED(true);

    private final boolean clientInput;

    GameErrorCode(boolean clientInput) {
        this.clientInput = clientInput;
    }

    public boolean isClientInput() {
        return clientInput;
    }
}
