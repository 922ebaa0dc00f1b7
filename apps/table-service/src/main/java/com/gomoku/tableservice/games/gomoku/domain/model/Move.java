package com.gomoku.tableservice.games.gomoku.domain.model;

/**
 * 一步棋：落在 (row, col)，从 0 开始计数。
 * 不携带棋子颜色，执子方由调用方（协调器）单独给出。
 */
public record Move(int row, int col) {

    @Override
    public String toString() {
        return "(" + row + ", " + col + ")";
    }
}
