package com.gomoku.tableservice.games.gomoku.domain.ai;

import com.gomoku.tableservice.games.gomoku.domain.model.Board;
import com.gomoku.tableservice.games.gomoku.domain.model.Role;
import com.gomoku.tableservice.games.gomoku.domain.rule.WinDetector;

/**
 * 单点评估：假设 role 落在 (row,col) 时该点的静态分。
 * 分数 = 位置分 + 邻接分 + 棋型分，三部分相互独立。
 */
public final class PositionEvaluator {

    /** 同向已有己方连子 ≥4（不含候选点） */
    public static final int SCORE_FOUR = 100_000;
    /** 已有连三且至少一端空 */
    public static final int SCORE_THREE = 10_000;
    /** 已有连二且两端皆空 */
    public static final int SCORE_OPEN_TWO = 1_000;

    /** 每个相邻己方子 */
    public static final int ADJ_OWN = 50;
    /** 每个相邻对方子 */
    public static final int ADJ_OPP = -30;

    private static final int CENTER = Board.SIZE / 2;

    private static final int[][] DIRS = WinDetector.directions();

    // 8 邻域
    private static final int[][] NEIGHBORS = {
            {-1, -1}, {-1, 0}, {-1, 1},
            {0, -1},           {0, 1},
            {1, -1},  {1, 0},  {1, 1}
    };

    private PositionEvaluator() {
    }

    /** 总分 */
    public static int score(Board b, int row, int col, Role role) {
        return positional(row, col) + adjacency(b, row, col, role) + pattern(b, row, col, role);
    }

    /** 越靠近中心越高：(10 - 曼哈顿距离) * 10，角上为负 */
    public static int positional(int row, int col) {
        int dist = Math.abs(row - CENTER) + Math.abs(col - CENTER);
        return (10 - dist) * 10;
    }

    /** 8 邻域内己方子加分、对方子减分 */
    public static int adjacency(Board b, int row, int col, Role role) {
        int s = 0;
        for (int[] d : NEIGHBORS) {
            int r = row + d[0], c = col + d[1];
            if (!b.inBounds(r, c)) continue;
            Role p = b.get(r, c);
            if (p == null) continue;
            s += (p == role) ? ADJ_OWN : ADJ_OPP;
        }
        return s;
    }

    /**
     * 四个方向各自计棋型分后求和。
     * 只数候选点两侧已经存在的己方连子，候选点本身不计入。
     */
    public static int pattern(Board b, int row, int col, Role role) {
        int s = 0;
        for (int[] d : DIRS) {
            int existing = WinDetector.lineLength(b, row, col, role, d[0], d[1]) - 1;
            int opens = openEnds(b, row, col, role, d[0], d[1]);
            if (existing >= 4) {
                s += SCORE_FOUR;
            } else if (existing == 3 && opens >= 1) {
                s += SCORE_THREE;
            } else if (existing == 2 && opens == 2) {
                s += SCORE_OPEN_TWO;
            }
        }
        return s;
    }

    /** 连子两端紧邻的空位数（0~2），越界算堵死 */
    public static int openEnds(Board b, int row, int col, Role role, int dr, int dc) {
        int opens = 0;
        int fwd = WinDetector.countDirection(b, row, col, dr, dc, role);
        if (b.isEmpty(row + dr * (fwd + 1), col + dc * (fwd + 1))) opens++;
        int back = WinDetector.countDirection(b, row, col, -dr, -dc, role);
        if (b.isEmpty(row - dr * (back + 1), col - dc * (back + 1))) opens++;
        return opens;
    }
}
