package com.gomoku.tableservice.games.gomoku.application;

import com.gomoku.tableservice.games.gomoku.domain.ai.SearchEngine;
import com.gomoku.tableservice.games.gomoku.domain.exception.GameErrorCode;
import com.gomoku.tableservice.games.gomoku.domain.exception.GameException;
import com.gomoku.tableservice.games.gomoku.domain.model.Move;
import com.gomoku.tableservice.games.gomoku.domain.model.Role;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class SessionCoordinatorConcurrencyTest {

    @Test
    void concurrentSubmittersNeverBothWinTheSameTurn() throws Exception {
        SessionCoordinator c = new SessionCoordinator("t1", new SearchEngine(), false);
        c.join("alice", new RecordingChannel("a"));
        c.join("bob", new RecordingChannel("b"));

        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<GameErrorCode>> results = new ArrayList<>();
        try {
            for (int i = 0; i < threads; i++) {
                Move move = new Move(i, i);
                results.add(pool.submit(() -> {
                    start.await();
                    try {
                        c.submitMove(Role.BLACK, move);
                        return null;
                    } catch (GameException e) {
                        return e.getCode();
                    }
                }));
            }
            start.countDown();

            int ok = 0;
            for (Future<GameErrorCode> f : results) {
                GameErrorCode code = f.get(10, TimeUnit.SECONDS);
                if (code == null) ok++;
                else assertEquals(GameErrorCode.NOT_YOUR_TURN, code);
            }
            assertEquals(1, ok);
            assertEquals(1, c.board().stoneCount());
            assertEquals(Role.WHITE, c.board().currentTurn());
        } finally {
            pool.shutdownNow();
        }
    }
}
