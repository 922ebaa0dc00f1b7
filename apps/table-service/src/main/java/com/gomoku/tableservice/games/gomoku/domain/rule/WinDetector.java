package com.gomoku.tableservice.games.gomoku.domain.rule;

import com.gomoku.tableservice.games.gomoku.domain.model.Board;
import com.gomoku.tableservice.games.gomoku.domain.model.Role;

import java.util.Optional;

/**
 * 核心规则判断
 * 胜负判定（自由五子棋，不含禁手）：任意一方在横、竖、主对角、反对角任一方向上连成五子即胜。
 * 只包含纯判断逻辑，不修改棋盘。
 */
public final class WinDetector {

    /** 连成几子获胜 */
    public static final int WIN_LENGTH = 5;

    // 4 个方向：横、竖、主对角、反对角
    private static final int[][] DIRS = {
            {0, 1},  // →
            {1, 0},  // ↓
            {1, 1},  // ↘
            {1, -1}  // ↙
    };

    private WinDetector() {
    }

    /** 四个方向向量（返回副本） */
    public static int[][] directions() {
        int[][] copy = new int[DIRS.length][];
        for (int i = 0; i < DIRS.length; i++) copy[i] = DIRS[i].clone();
        return copy;
    }

    /**
     * 全盘扫描：对每个有子的点、每个方向，向前向后数同色连子，
     * 合计达到 5 立即返回该方；找不到返回 empty。
     */
    public static Optional<Role> check(Board b) {
        for (int row = 0; row < Board.SIZE; row++) {
            for (int col = 0; col < Board.SIZE; col++) {
                Role p = b.get(row, col);
                if (p == null) continue;
                for (int[] d : DIRS) {
                    if (lineLength(b, row, col, p, d[0], d[1]) >= WIN_LENGTH) {
                        return Optional.of(p);
                    }
                }
            }
        }
        return Optional.empty();
    }

    /**
     * 假设 (row,col) 属于 role 时，经过该点在 (dr,dc) 方向上的连子长度（含该点）。
     * 该点本身是否已落子不影响结果，AI 落子前试算也走这里。
     */
    public static int lineLength(Board b, int row, int col, Role role, int dr, int dc) {
        return 1 + countDirection(b, row, col, dr, dc, role)
                + countDirection(b, row, col, -dr, -dc, role);
    }

    /** role 落在 (row,col) 后是否成五（落子前试算） */
    public static boolean wouldComplete(Board b, int row, int col, Role role) {
        for (int[] d : DIRS) {
            if (lineLength(b, row, col, role, d[0], d[1]) >= WIN_LENGTH) return true;
        }
        return false;
    }

    /**
     * 沿某个方向数连续相同棋子（不含起点），直到越界或遇到不同棋子停止
     * @param dr 行偏移量
     * @param dc 列偏移量
     */
    public static int countDirection(Board b, int row, int col, int dr, int dc, Role role) {
        int c = 0;
        row += dr; col += dc;
        while (b.inBounds(row, col) && b.get(row, col) == role) {
            c++; row += dr; col += dc;
        }
        return c;
    }
}
