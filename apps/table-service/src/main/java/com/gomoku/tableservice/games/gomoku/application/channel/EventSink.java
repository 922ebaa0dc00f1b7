package com.gomoku.tableservice.games.gomoku.application.channel;

import com.gomoku.tableservice.games.gomoku.application.event.TableEvent;

/** 事件真正写到网络的出口（由传输层实现） */
@FunctionalInterface
public interface EventSink {

    void send(String channelId, TableEvent event);
}
