package com.gomoku.tableservice.games.gomoku.domain.ai;

/** AI 选点策略 */
public enum SearchStrategy {
    /** 威胁优先 + 启发式递归搜索（默认） */
    HEURISTIC,
    /** 随机空位（降级/简单模式） */
    RANDOM
}
