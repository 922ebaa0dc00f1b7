package com.gomoku.tableservice.games.gomoku.domain.ai;

import com.gomoku.tableservice.games.gomoku.domain.constants.GameMessages;
import com.gomoku.tableservice.games.gomoku.domain.exception.GameErrorCode;
import com.gomoku.tableservice.games.gomoku.domain.exception.GameException;
import com.gomoku.tableservice.games.gomoku.domain.model.Board;
import com.gomoku.tableservice.games.gomoku.domain.model.Move;
import com.gomoku.tableservice.games.gomoku.domain.model.Role;
import com.gomoku.tableservice.games.gomoku.domain.model.ScratchBoard;
import com.gomoku.tableservice.games.gomoku.domain.rule.WinDetector;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Random;


/**
 * SearchEngine：
 * 1) 立即胜利优先（我方一下成五直接下）
 * 2) 立即防守优先（先堵对方成五，再堵对方活四）
 * 3) 启发式搜索：单点静态分 - 对方最佳应手分 / 2，逐层换手递归到指定深度
 *
 * 顶层遍历全部空位；递归的每一层只看有邻子的空位里静态分最高的 replyWidth 个（默认 6），
 * 所以它是近似搜索，不保证找到全局最优应手。
 *
 * 只读传入的棋盘：试探落子全部发生在 scratch() 出来的草稿棋盘上。
 * RANDOM 策略跳过以上步骤，直接在空位中随机选一个。
 */
public class SearchEngine implements MoveAdvisor {

    public static final int DEFAULT_DEPTH = 3;
    public static final int DEFAULT_REPLY_WIDTH = 6;

    private static final int[][] DIRS = WinDetector.directions();

    private final int depth;
    private final int replyWidth;
    private final SearchStrategy strategy;
    private final Random random;

    public SearchEngine() {
        this(DEFAULT_DEPTH, DEFAULT_REPLY_WIDTH, SearchStrategy.HEURISTIC, new Random());
    }

    public SearchEngine(int depth, int replyWidth, SearchStrategy strategy, Random random) {
        this.depth = Math.max(0, depth);
        this.replyWidth = Math.max(1, replyWidth);
        this.strategy = strategy == null ? SearchStrategy.HEURISTIC : strategy;
        this.random = random == null ? new Random() : random;
    }

    @Override
    public Move recommend(Board board, Role role) {
        if (board.isFull()) {
            throw new GameException(GameErrorCode.NO_LEGAL_MOVE, GameMessages.NO_LEGAL_MOVE);
        }
        if (strategy == SearchStrategy.RANDOM) {
            return randomMove(board);
        }

        // 1) 我方一步即胜
        Move winNow = findFirst(board, role, true);
        if (winNow != null) return winNow;

        Role opp = role.other();

        // 2) 对方一步即胜（先堵），再看对方活四
        Move oppWin = findFirst(board, opp, true);
        if (oppWin != null) return oppWin;
        Move oppFour = findFirst(board, opp, false);
        if (oppFour != null) return oppFour;

        // 3) 启发式搜索（全部空位参与，同分取行优先的第一个）
        ScratchBoard scratch = board.scratch();
        int bestScore = Integer.MIN_VALUE;
        Move best = null;
        for (int r = 0; r < Board.SIZE; r++) {
            for (int c = 0; c < Board.SIZE; c++) {
                if (!scratch.isEmpty(r, c)) continue;
                int score = scoreWithReply(scratch, r, c, role, depth);
                if (score > bestScore) {
                    bestScore = score;
                    best = new Move(r, c);
                }
            }
        }
        return best;
    }

    /**
     * 行优先找第一个空位：five=true 找落下即成五的点，否则找落下形成活四（四连且至少一端空）的点。
     */
    private Move findFirst(Board b, Role side, boolean five) {
        for (int r = 0; r < Board.SIZE; r++) {
            for (int c = 0; c < Board.SIZE; c++) {
                if (!b.isEmpty(r, c)) continue;
                if (five ? WinDetector.wouldComplete(b, r, c, side) : makesOpenFour(b, r, c, side)) {
                    return new Move(r, c);
                }
            }
        }
        return null;
    }

    private boolean makesOpenFour(Board b, int row, int col, Role side) {
        for (int[] d : DIRS) {
            int run = WinDetector.lineLength(b, row, col, side, d[0], d[1]);
            if (run == 4 && PositionEvaluator.openEnds(b, row, col, side, d[0], d[1]) >= 1) {
                return true;
            }
        }
        return false;
    }

    /**
     * role 落在 (row,col) 的得分：静态分减去对方最佳应手的一半。
     * 成五的点不再往下展开（对局在此结束）。
     */
    private int scoreWithReply(ScratchBoard scratch, int row, int col, Role role, int remaining) {
        int score = PositionEvaluator.score(scratch, row, col, role);
        if (remaining <= 0 || WinDetector.wouldComplete(scratch, row, col, role)) {
            return score;
        }
        scratch.setStone(row, col, role);
        try {
            return score - bestReply(scratch, role.other(), remaining - 1) / 2;
        } finally {
            scratch.removeStone(row, col);
        }
    }

    /** 对方最佳应手分：只看有邻子的空位，按静态分取前 replyWidth 个；无可应手时为 0 */
    private int bestReply(ScratchBoard scratch, Role side, int remaining) {
        int best = 0;
        for (int[] p : replies(scratch, side)) {
            int s = scoreWithReply(scratch, p[0], p[1], side, remaining);
            if (s > best) best = s;
        }
        return best;
    }

    /** 候选应手：{row, col, staticScore}，静态分降序，稳定排序保证同分时行优先 */
    private List<int[]> replies(Board b, Role side) {
        List<int[]> list = new ArrayList<>();
        for (int r = 0; r < Board.SIZE; r++) {
            for (int c = 0; c < Board.SIZE; c++) {
                if (!b.isEmpty(r, c) || !hasNeighbor(b, r, c)) continue;
                list.add(new int[]{r, c, PositionEvaluator.score(b, r, c, side)});
            }
        }
        list.sort(Comparator.comparingInt((int[] a) -> a[2]).reversed());
        return list.size() > replyWidth ? list.subList(0, replyWidth) : list;
    }

    private boolean hasNeighbor(Board b, int row, int col) {
        for (int dr = -1; dr <= 1; dr++) {
            for (int dc = -1; dc <= 1; dc++) {
                if (dr == 0 && dc == 0) continue;
                int r = row + dr, c = col + dc;
                if (b.inBounds(r, c) && b.get(r, c) != null) return true;
            }
        }
        return false;
    }

    private Move randomMove(Board b) {
        List<Move> empties = new ArrayList<>();
        for (int r = 0; r < Board.SIZE; r++)
            for (int c = 0; c < Board.SIZE; c++)
                if (b.isEmpty(r, c)) empties.add(new Move(r, c));
        return empties.get(random.nextInt(empties.size()));
    }
}
