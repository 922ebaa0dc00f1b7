package com.gomoku.tableservice.platform.transport;

import java.io.Serial;
import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * 传输消息外壳
 * - 强类型泛型载荷：Envelope<T>
 * - 字段：kind / game / tableId / type / payload / ts / seq
 *
 * 用法示例：
 *   Envelope<BoardState> msg = Envelope.of(Kind.STATE, "gomoku", tableId, "BOARD_STATE", state, seq);
 *
 * @param kind 消息类别（语义层）：STATE=完整状态，EVENT=增量事件，ERROR=错误通知
 * @param type 具体事件类型，前端按它分发
 * @param ts   服务器时间戳（ms）
 * @param seq  同一连接内递增序号，没有就传 0
 */
public record Envelope<T>(Kind kind, String game, String tableId, String type, T payload, long ts, long seq)
        implements Serializable {
    @Serial private static final long serialVersionUID = 1L;

    public enum Kind { STATE, EVENT, ERROR }

    public Envelope {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(game, "game");
        Objects.requireNonNull(tableId, "tableId");
        Objects.requireNonNull(type, "type");
    }

    /** 自由构造（若不关心 seq，传 0） */
    public static <T> Envelope<T> of(Kind kind, String game, String tableId, String type, T payload, long seq) {
        return new Envelope<>(kind, game, tableId, type, payload, Instant.now().toEpochMilli(), seq);
    }
}
