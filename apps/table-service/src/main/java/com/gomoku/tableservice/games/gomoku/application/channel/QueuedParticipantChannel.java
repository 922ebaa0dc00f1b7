package com.gomoku.tableservice.games.gomoku.application.channel;

import com.gomoku.tableservice.games.gomoku.application.event.TableEvent;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

/**
 * 有界队列通道：协调器 offer 入队，独立的投递任务按顺序取出写给 EventSink。
 * - deliver() 从不阻塞（协调器持锁调用它）：队列满就只丢这一条、只影响这一个参与者
 * - close() 之后投递任务把剩余事件送完再退出
 */
@Slf4j
public class QueuedParticipantChannel implements ParticipantChannel {

    /** 投递任务空转时的轮询间隔 */
    private static final long POLL_MS = 200;

    private final String id;
    private final BlockingQueue<TableEvent> queue;
    private final EventSink sink;
    private volatile boolean closed;

    private QueuedParticipantChannel(String id, int capacity, EventSink sink) {
        this.id = id;
        this.queue = new ArrayBlockingQueue<>(Math.max(1, capacity));
        this.sink = sink;
    }

    /** 创建通道并在 executor 上启动它的投递任务 */
    public static QueuedParticipantChannel open(String id, int capacity, EventSink sink, Executor executor) {
        QueuedParticipantChannel ch = new QueuedParticipantChannel(id, capacity, sink);
        executor.execute(ch::pump);
        return ch;
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public boolean deliver(TableEvent event) {
        if (closed) {
            log.debug("通道已关闭，丢弃事件: channel={}, type={}", id, event.getType());
            return false;
        }
        if (queue.offer(event)) {
            return true;
        }
        log.warn("通道队列已满，丢弃事件: channel={}, type={}", id, event.getType());
        return false;
    }

    @Override
    public void close() {
        closed = true;
    }

    public boolean isClosed() {
        return closed;
    }

    private void pump() {
        try {
            while (!closed || !queue.isEmpty()) {
                TableEvent ev = queue.poll(POLL_MS, TimeUnit.MILLISECONDS);
                if (ev == null) continue;
                try {
                    sink.send(id, ev);
                } catch (RuntimeException e) {
                    log.warn("事件发送失败: channel={}, type={}", id, ev.getType(), e);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("投递任务被中断: channel={}, 剩余 {} 条未发送", id, queue.size());
        }
        log.debug("投递任务结束: channel={}", id);
    }

    @Override
    public String toString() {
        return "QueuedParticipantChannel{" + id + '}';
    }
}
