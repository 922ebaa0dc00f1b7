package com.gomoku.tableservice.games.gomoku.domain.model;

import com.gomoku.tableservice.games.gomoku.domain.constants.GameMessages;
import com.gomoku.tableservice.games.gomoku.domain.exception.GameErrorCode;
import com.gomoku.tableservice.games.gomoku.domain.exception.GameException;

import java.util.Objects;

/**
 * 五子棋棋盘：15x15 网格 + 当前执子方。
 * 约定：EMPTY='.', BLACK='X', WHITE='O'（仅用于序列化/日志，内部用 Role 存储，null 表示空位）。
 *
 * 设计说明
 * - place() 是唯一的对局落子入口：校验通过后一次性“落子 + 换手”，失败则棋盘完全不变。
 * - 试探落子只在 {@link ScratchBoard} 上进行（见 scratch()），实盘类型上没有不校验的写入口。
 * - copy() 深拷贝，胜负判定与 AI 搜索都只读副本。
 */
public class Board {
    /** 棋盘尺寸（15x15） */
    public static final int SIZE = 15;
    /** 空位标记 */
    public static final char EMPTY = '.';

    /** 棋盘二维数组，null 表示未落子 */
    private final Role[][] grid = new Role[SIZE][SIZE];

    /** 当前轮到谁，新盘黑先 */
    private Role currentTurn = Role.BLACK;

    /** 是否在棋盘内 */
    public boolean inBounds(int row, int col) {
        return row >= 0 && row < SIZE && col >= 0 && col < SIZE;
    }

    /** 读取该点的棋子，空位返回 null */
    public Role get(int row, int col) {
        return grid[row][col];
    }

    /** 该点是否为空（越界视为不可用） */
    public boolean isEmpty(int row, int col) {
        return inBounds(row, col) && grid[row][col] == null;
    }

    public Role currentTurn() {
        return currentTurn;
    }

    /**
     * 对局落子：越界 → 轮次 → 占用，依次校验；通过后落子并切换执子方。
     *
     * @throws GameException OUT_OF_BOUNDS / NOT_YOUR_TURN / POSITION_OCCUPIED
     */
    public void place(Move move, Role role) {
        Objects.requireNonNull(move, "move");
        Objects.requireNonNull(role, "role");
        int row = move.row(), col = move.col();
        if (!inBounds(row, col)) {
            throw new GameException(GameErrorCode.OUT_OF_BOUNDS,
                    GameMessages.formatOutOfBounds(SIZE - 1, row, col));
        }
        if (role != currentTurn) {
            throw new GameException(GameErrorCode.NOT_YOUR_TURN,
                    GameMessages.formatNotYourTurn(currentTurn.name()));
        }
        if (grid[row][col] != null) {
            throw new GameException(GameErrorCode.POSITION_OCCUPIED,
                    GameMessages.formatPositionOccupied(row, col));
        }
        grid[row][col] = role;
        currentTurn = role.other();
    }

    /** 直接写格子，不校验不换手；只对同包的 ScratchBoard 开放 */
    void putCell(int row, int col, Role role) {
        grid[row][col] = role;
    }

    /** 棋盘是否已满（用于和棋判断） */
    public boolean isFull() {
        for (int i = 0; i < SIZE; i++)
            for (int j = 0; j < SIZE; j++)
                if (grid[i][j] == null) return false;
        return true;
    }

    /** 已落子数 */
    public int stoneCount() {
        int n = 0;
        for (int i = 0; i < SIZE; i++)
            for (int j = 0; j < SIZE; j++)
                if (grid[i][j] != null) n++;
        return n;
    }

    /** 深拷贝棋盘（供胜负判定/AI 模拟使用） */
    public Board copy() {
        return copyInto(new Board());
    }

    /** 深拷贝成草稿棋盘，AI 在上面试探落子 */
    public ScratchBoard scratch() {
        return copyInto(new ScratchBoard());
    }

    private <B extends Board> B copyInto(B target) {
        Board b = target;
        for (int i = 0; i < SIZE; i++) b.grid[i] = grid[i].clone();
        b.currentTurn = currentTurn;
        return target;
    }

    /** 按行输出的只读视图（用于序列化给前端/日志），每行形如 "..X.O.........." */
    public String[] rows() {
        String[] rows = new String[SIZE];
        for (int i = 0; i < SIZE; i++) {
            char[] line = new char[SIZE];
            for (int j = 0; j < SIZE; j++) {
                line[j] = grid[i][j] == null ? EMPTY : grid[i][j].symbol();
            }
            rows[i] = new String(line);
        }
        return rows;
    }

    /**
     * 由行字符串构造局面（'X'/'O'/'.'），不校验子数是否交替。
     *
     * @param toMove 该局面下轮到谁
     * @throws IllegalArgumentException 行数或行宽不是 15，或包含无法识别的字符
     */
    public static Board fromRows(Role toMove, String... rows) {
        Objects.requireNonNull(toMove, "toMove");
        if (rows == null || rows.length != SIZE) {
            throw new IllegalArgumentException("棋盘必须是 " + SIZE + " 行");
        }
        Board b = new Board();
        for (int i = 0; i < SIZE; i++) {
            String line = rows[i];
            if (line == null || line.length() != SIZE) {
                throw new IllegalArgumentException("第 " + i + " 行宽度必须是 " + SIZE);
            }
            for (int j = 0; j < SIZE; j++) {
                char c = line.charAt(j);
                if (c == EMPTY) continue;
                Role r = Role.fromSymbol(c);
                if (r == null) {
                    throw new IllegalArgumentException("第 " + i + " 行包含非法字符: " + c);
                }
                b.grid[i][j] = r;
            }
        }
        b.currentTurn = toMove;
        return b;
    }

    @Override
    public String toString() {
        return String.join("\n", rows()) + "\n(to move: " + currentTurn + ")";
    }
}
