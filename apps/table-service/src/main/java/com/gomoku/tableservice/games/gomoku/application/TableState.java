package com.gomoku.tableservice.games.gomoku.application;

/** 牌桌生命周期 */
public enum TableState {
    /** 没有真人 */
    EMPTY,
    /** 只有一方行动者（AI 关闭，或对手断线后停摆） */
    AWAITING_SECOND_PLAYER,
    /** 两方就位，对局进行中 */
    IN_PLAY,
    /** 本盘已分出胜负或下满 */
    FINISHED
}
