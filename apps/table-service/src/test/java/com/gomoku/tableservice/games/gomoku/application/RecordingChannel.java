package com.gomoku.tableservice.games.gomoku.application;

import com.gomoku.tableservice.games.gomoku.application.channel.ParticipantChannel;
import com.gomoku.tableservice.games.gomoku.application.event.EventType;
import com.gomoku.tableservice.games.gomoku.application.event.TableEvent;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/** 测试用通道：同步记录收到的事件 */
class RecordingChannel implements ParticipantChannel {

    private final String id;
    final List<TableEvent> events = new CopyOnWriteArrayList<>();
    volatile boolean closed;

    RecordingChannel(String id) {
        this.id = id;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public boolean deliver(TableEvent event) {
        events.add(event);
        return true;
    }

    @Override
    public void close() {
        closed = true;
    }

    List<EventType> types() {
        return events.stream().map(TableEvent::getType).toList();
    }

    long count(EventType type) {
        return events.stream().filter(e -> e.getType() == type).count();
    }

    TableEvent last(EventType type) {
        for (int i = events.size() - 1; i >= 0; i--) {
            if (events.get(i).getType() == type) return events.get(i);
        }
        return null;
    }

    void clear() {
        events.clear();
    }
}
