package com.gomoku.tableservice.games.gomoku.domain.model;

/**
 * 草稿棋盘：允许不校验、不换手地摆子和撤子。
 * 只能通过 {@link Board#scratch()} 从实盘拷贝得到（或直接 new 一张空的），写操作不会影响原棋盘。
 */
public class ScratchBoard extends Board {

    /** 试探落子 */
    public void setStone(int row, int col, Role role) {
        putCell(row, col, role);
    }

    /** 撤销试探落子 */
    public void removeStone(int row, int col) {
        putCell(row, col, null);
    }
}
