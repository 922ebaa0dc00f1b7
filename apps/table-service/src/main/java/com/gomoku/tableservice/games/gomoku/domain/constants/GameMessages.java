package com.gomoku.tableservice.games.gomoku.domain.constants;

/**
 * 五子棋牌桌相关的消息常量
 * 统一管理所有用户可见的提示消息，避免硬编码
 *
 * 使用示例：
 *   throw new GameException(GameErrorCode.TABLE_FULL, GameMessages.TABLE_FULL);
 *   channel.deliver(TableEvent.error(code, GameMessages.formatNotYourTurn("X")));
 */
public final class GameMessages {

    private GameMessages() {
        // 工具类，禁止实例化
    }

    // ========== 落子校验 ==========

    /** 坐标越界（需要格式化，传入最大下标与实际坐标） */
    public static final String OUT_OF_BOUNDS = "行和列必须在 0-%d 之间，你输入的是 (%d, %d)";

    /** 位置已被占用 */
    public static final String POSITION_OCCUPIED = "位置 (%d, %d) 已经被占用";

    /** 未轮到该方走棋 */
    public static final String NOT_YOUR_TURN = "不是你的回合（当前应为 %s）";

    public static String formatOutOfBounds(int maxIndex, int row, int col) {
        return String.format(OUT_OF_BOUNDS, maxIndex, row, col);
    }

    public static String formatPositionOccupied(int row, int col) {
        return String.format(POSITION_OCCUPIED, row, col);
    }

    public static String formatNotYourTurn(String currentSide) {
        return String.format(NOT_YOUR_TURN, currentSide);
    }

    // ========== 牌桌状态 ==========

    /** 两个真人座位均已占用 */
    public static final String TABLE_FULL = "游戏已满";

    /** 缺少对手 */
    public static final String TABLE_NOT_READY = "等待另一个玩家加入";

    /** 本盘已结束 */
    public static final String GAME_OVER = "本盘已结束，请重新开局";

    /** 本盘尚未结束 */
    public static final String GAME_IN_PROGRESS = "本盘尚未结束，不能重开";

    /** 未入座 */
    public static final String NOT_SEATED = "你尚未入座，请先加入牌桌";

    /** 棋盘已满 */
    public static final String NO_LEGAL_MOVE = "没有可用的位置";

    // ========== 传输层 ==========

    /** 入站消息无法解析 */
    public static final String MALFORMED_MESSAGE = "无效的消息格式";

    /** 缺少坐标 */
    public static final String MISSING_COORDINATES = "落子消息缺少行或列";

    /** 同一连接重复加入 */
    public static final String ALREADY_JOINED = "当前连接已经入座";

    /** 未填写昵称时的默认显示名 */
    public static final String ANONYMOUS_PLAYER = "匿名玩家";
}
