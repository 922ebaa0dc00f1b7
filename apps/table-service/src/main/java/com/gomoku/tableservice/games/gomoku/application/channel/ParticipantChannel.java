package com.gomoku.tableservice.games.gomoku.application.channel;

import com.gomoku.tableservice.games.gomoku.application.event.TableEvent;

/**
 * 参与者的出站通道。协调器只依赖这个接口，不关心底层是 WebSocket 还是测试桩。
 */
public interface ParticipantChannel {

    /** 通道标识（WebSocket 场景下为 sessionId） */
    String id();

    /**
     * 投递一条事件，不能无限期阻塞调用方。
     * @return false 表示该事件对这个参与者被丢弃（队列满或通道已关闭）
     */
    boolean deliver(TableEvent event);

    /** 关闭通道：不再接收新事件，已排队的事件仍会尽量送出 */
    void close();
}
