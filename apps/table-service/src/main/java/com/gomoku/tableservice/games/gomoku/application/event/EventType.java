package com.gomoku.tableservice.games.gomoku.application.event;

/** 推给参与者的事件类型（前端按 type 分发） */
public enum EventType {
    JOIN_ACCEPTED,
    JOIN_REJECTED,
    MOVE_APPLIED,
    BOARD_STATE,
    /** 轮到你走 */
    TURN,
    PARTICIPANT_JOINED,
    PARTICIPANT_LEFT,
    GAME_OVER,
    ERROR,
    SERVER_SHUTDOWN
}
