package com.gomoku.tableservice.games.gomoku.domain.model;

/**
 * 执子方：黑（先手）/ 白。
 * 约定：BLACK='X', WHITE='O'，与棋盘序列化符号保持一致。
 */
public enum Role {
    /** 黑方，新盘默认先手 */
    BLACK('X'),
    /** 白方 */
    WHITE('O');

    private final char symbol;

    Role(char symbol) {
        this.symbol = symbol;
    }

    /** 对手方（只有两方，不存在第三种状态） */
    public Role other() {
        return this == BLACK ? WHITE : BLACK;
    }

    /** 棋盘上的符号 */
    public char symbol() {
        return symbol;
    }

    /** 由符号还原执子方；'.' 或其他字符返回 null */
    public static Role fromSymbol(char c) {
        char u = Character.toUpperCase(c);
        if (u == BLACK.symbol) return BLACK;
        if (u == WHITE.symbol) return WHITE;
        return null;
    }

    /**
     * 宽松解析：接受 "BLACK"/"WHITE"（大小写不敏感）或单个符号 "X"/"O"。
     * @throws IllegalArgumentException 无法识别时
     */
    public static Role parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("执子方不能为空");
        }
        String t = text.trim();
        if (t.length() == 1) {
            Role r = fromSymbol(t.charAt(0));
            if (r != null) return r;
        }
        for (Role r : values()) {
            if (r.name().equalsIgnoreCase(t)) return r;
        }
        throw new IllegalArgumentException("无法识别的执子方: " + text);
    }
}
