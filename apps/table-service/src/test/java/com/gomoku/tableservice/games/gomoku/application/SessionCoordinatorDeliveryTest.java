package com.gomoku.tableservice.games.gomoku.application;

import com.gomoku.tableservice.games.gomoku.application.channel.QueuedParticipantChannel;
import com.gomoku.tableservice.games.gomoku.application.event.EventType;
import com.gomoku.tableservice.games.gomoku.domain.ai.MoveAdvisor;
import com.gomoku.tableservice.games.gomoku.domain.model.Move;
import com.gomoku.tableservice.games.gomoku.domain.model.Role;
import com.gomoku.tableservice.games.gomoku.domain.rule.Outcome;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/** 一个参与者的连接卡住时，协调器和其他参与者不受影响 */
class SessionCoordinatorDeliveryTest {

    private static final MoveAdvisor UNUSED = (board, role) -> {
        throw new IllegalStateException("no ai in this table");
    };

    private final ExecutorService executor = Executors.newCachedThreadPool();
    private final CountDownLatch release = new CountDownLatch(1);

    @AfterEach
    void tearDown() {
        release.countDown();
        executor.shutdownNow();
    }

    @Test
    void stalledRecipientDoesNotHoldTheLockOrDelayOthers() throws Exception {
        // 黑方的 sink 一直卡住，队列容量 2，很快就满
        QueuedParticipantChannel black = QueuedParticipantChannel.open("s-black", 2, (id, ev) -> {
            try {
                release.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, executor);
        CountDownLatch whiteSawMove = new CountDownLatch(1);
        QueuedParticipantChannel white = QueuedParticipantChannel.open("s-white", 32, (id, ev) -> {
            if (ev.getType() == EventType.MOVE_APPLIED) whiteSawMove.countDown();
        }, executor);

        SessionCoordinator c = new SessionCoordinator("t1", UNUSED, false);
        c.join("alice", black);
        c.join("bob", white);

        long start = System.nanoTime();
        assertEquals(Outcome.IN_PROGRESS, c.submitMove(Role.BLACK, new Move(7, 7)));
        long submitMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
        assertTrue(submitMs < 200, "submitMove took " + submitMs + " ms");

        assertTrue(whiteSawMove.await(300, TimeUnit.MILLISECONDS));
        // 锁没有被占住：白方马上可以继续落子
        assertEquals(Outcome.IN_PROGRESS, c.submitMove(Role.WHITE, new Move(0, 0)));
        assertEquals(2, c.board().stoneCount());

        black.close();
        white.close();
    }
}
