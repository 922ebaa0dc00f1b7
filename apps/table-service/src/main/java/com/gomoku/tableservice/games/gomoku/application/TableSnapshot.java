package com.gomoku.tableservice.games.gomoku.application;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.gomoku.tableservice.games.gomoku.domain.model.Role;
import com.gomoku.tableservice.games.gomoku.domain.rule.Outcome;

/**
 * 牌桌只读快照（加锁时拍下，之后与牌桌再无关联）。
 *
 * @param grid        15 行字符串，'X' 黑 / 'O' 白 / '.' 空
 * @param blackPlayer 黑方真人昵称；AI 或空座为 null
 * @param whitePlayer 白方真人昵称；AI 或空座为 null
 * @param aiRole      AI 持有的执子方；未绑定 AI 为 null
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TableSnapshot(
        String tableId,
        TableState state,
        String[] grid,
        Role currentTurn,
        String blackPlayer,
        String whitePlayer,
        Role aiRole,
        Outcome outcome,
        int stoneCount
) { }
