package com.gomoku.tableservice.games.gomoku.domain.ai;

import com.gomoku.tableservice.games.gomoku.domain.model.Board;
import com.gomoku.tableservice.games.gomoku.domain.model.Move;
import com.gomoku.tableservice.games.gomoku.domain.model.Role;

/**
 * 落子建议：给定局面与执子方，返回下一步。
 * 实现不得修改传入的棋盘，也不在两次调用之间保留状态。
 */
public interface MoveAdvisor {

    /**
     * @throws com.gomoku.tableservice.games.gomoku.domain.exception.GameException NO_LEGAL_MOVE 棋盘已满
     */
    Move recommend(Board board, Role role);
}
