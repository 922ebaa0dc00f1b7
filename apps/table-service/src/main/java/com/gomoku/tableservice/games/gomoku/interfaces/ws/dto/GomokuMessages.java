package com.gomoku.tableservice.games.gomoku.interfaces.ws.dto;

import lombok.Data;

/**
 * WebSocket 入站指令（客户端 → 服务端）。
 * 出站事件统一用 TableEvent + Envelope，不在这里定义。
 */
public class GomokuMessages {

    /**
     * 入座：/app/gomoku.join
     * displayName 可空，空白时显示为“匿名玩家”。
     */
    @Data
    public static class JoinCmd {
        private String displayName;
    }

    /**
     * 落子：/app/gomoku.move
     * 坐标用包装类型，缺失时能和 0 区分开。
     */
    @Data
    public static class MoveCmd {
        private Integer row;
        private Integer col;
    }

    /** 无参数指令（如重开） */
    @Data
    public static class SimpleCmd {
    }
}
