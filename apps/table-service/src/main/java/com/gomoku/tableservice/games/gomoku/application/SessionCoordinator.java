package com.gomoku.tableservice.games.gomoku.application;

import com.gomoku.tableservice.games.gomoku.application.Seat.AiSeat;
import com.gomoku.tableservice.games.gomoku.application.Seat.HumanSeat;
import com.gomoku.tableservice.games.gomoku.application.channel.ParticipantChannel;
import com.gomoku.tableservice.games.gomoku.application.event.TableEvent;
import com.gomoku.tableservice.games.gomoku.domain.ai.MoveAdvisor;
import com.gomoku.tableservice.games.gomoku.domain.constants.GameMessages;
import com.gomoku.tableservice.games.gomoku.domain.exception.GameErrorCode;
import com.gomoku.tableservice.games.gomoku.domain.exception.GameException;
import com.gomoku.tableservice.games.gomoku.domain.model.Board;
import com.gomoku.tableservice.games.gomoku.domain.model.Move;
import com.gomoku.tableservice.games.gomoku.domain.model.Role;
import com.gomoku.tableservice.games.gomoku.domain.rule.Outcome;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 单张牌桌的协调器：串行化所有变更（入座 / 落子 / 离开 / 关服 / 重开），维护轮次并向参与者广播事件。
 *
 * 并发模型
 * - 一把公平锁保护 board / seats / state / outcome，所有变更操作整段持锁
 * - AI 应手在触发它的那次 submitMove 的同一临界区内算出并落下，中间不会插入第三方操作
 * - 事件通过 ParticipantChannel 投递，deliver() 不阻塞（队列满即丢），持锁广播不受慢连接拖累
 *
 * 错误处理
 * - 所有失败都抛 GameException；若发起方是已入座真人，同时只给他推一条 ERROR 事件
 */
@Slf4j
public class SessionCoordinator {

    private final String tableId;
    private final MoveAdvisor advisor;
    private final boolean aiEnabled;

    private final ReentrantLock lock = new ReentrantLock(true);
    private final Map<Role, Seat> seats = new EnumMap<>(Role.class);

    private Board board = new Board();
    private Outcome outcome = Outcome.IN_PROGRESS;
    private TableState state = TableState.EMPTY;
    /** 棋盘版本：每次落子或换新棋盘 +1，用来判断提示缓存是否还有效 */
    private long boardVersion;

    private volatile Hint lastHint;

    private record Hint(long boardVersion, Role side, Move move) {
    }

    public SessionCoordinator(String tableId, MoveAdvisor advisor, boolean aiEnabled) {
        this.tableId = Objects.requireNonNull(tableId, "tableId");
        this.advisor = Objects.requireNonNull(advisor, "advisor");
        this.aiEnabled = aiEnabled;
    }

    public String tableId() {
        return tableId;
    }

    /**
     * 真人入座：按 黑 → 白 顺序分配第一个空位（AI 占着的位置视为空位，先解绑 AI）。
     * 入座后若只剩一名真人且启用了 AI，则把 AI 绑到另一方。
     *
     * @throws GameException TABLE_FULL 两个真人座位都已占用（同时给该通道推 JOIN_REJECTED）
     */
    public Role join(String displayName, ParticipantChannel channel) {
        Objects.requireNonNull(channel, "channel");
        String name = StringUtils.defaultIfBlank(StringUtils.trim(displayName), GameMessages.ANONYMOUS_PLAYER);
        lock.lock();
        try {
            Role role = firstFreeRole();
            if (role == null) {
                log.info("牌桌已满，拒绝入座: table={}, channel={}, name={}", tableId, channel.id(), name);
                channel.deliver(TableEvent.joinRejected(GameErrorCode.TABLE_FULL.name(), GameMessages.TABLE_FULL));
                throw new GameException(GameErrorCode.TABLE_FULL, GameMessages.TABLE_FULL);
            }
            if (seats.get(role) instanceof AiSeat) {
                log.info("真人接替 AI 座位: table={}, role={}", tableId, role);
            }
            seats.put(role, new HumanSeat(channel, name));

            if (humanCount() == 1 && aiEnabled && seats.get(role.other()) == null) {
                seats.put(role.other(), new AiSeat(advisor));
                log.info("绑定 AI: table={}, aiRole={}", tableId, role.other());
            }
            refreshState();
            log.info("玩家入座: table={}, role={}, name={}, state={}", tableId, role, name, state);

            channel.deliver(TableEvent.joinAccepted(role));
            channel.deliver(TableEvent.boardState(board));
            broadcast(TableEvent.participantJoined(role, name));
            if (state == TableState.IN_PLAY) {
                notifyTurn();
                advanceAi();
            }
            return role;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 真人落子。成功后广播 MOVE_APPLIED + BOARD_STATE，再推 TURN 或 GAME_OVER；
     * 若未终局且下一手归 AI，则在同一把锁内算出并落下 AI 的应手。
     *
     * @return 本次调用结束时的对局结果（包含 AI 应手之后的局面）
     * @throws GameException NOT_SEATED / TABLE_NOT_READY / GAME_OVER / OUT_OF_BOUNDS / NOT_YOUR_TURN / POSITION_OCCUPIED
     */
    public Outcome submitMove(Role role, Move move) {
        Objects.requireNonNull(move, "move");
        lock.lock();
        try {
            HumanSeat seat = humanAt(role);
            if (seat == null) {
                throw new GameException(GameErrorCode.NOT_SEATED, GameMessages.NOT_SEATED);
            }
            if (seats.size() < 2) {
                throw fail(seat, GameErrorCode.TABLE_NOT_READY, GameMessages.TABLE_NOT_READY);
            }
            if (outcome.isTerminal()) {
                throw fail(seat, GameErrorCode.GAME_OVER, GameMessages.GAME_OVER);
            }
            try {
                board.place(move, role);
            } catch (GameException e) {
                log.debug("落子被拒: table={}, role={}, move={}, code={}", tableId, role, move, e.getCode());
                throw fail(seat, e.getCode(), e.getMessage());
            }
            afterMove(move, role);
            advanceAi();
            return outcome;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 真人离开（断线）。没有真人了就换新棋盘、解绑 AI、回到 EMPTY；
     * 还剩一名真人时不重新绑定 AI，牌桌停摆等待下一位入座。
     * 对未入座的 role 调用是空操作。
     */
    public void leave(Role role) {
        lock.lock();
        try {
            if (humanAt(role) == null) {
                log.debug("离开请求忽略（该方不是真人座位）: table={}, role={}", tableId, role);
                return;
            }
            seats.remove(role);
            log.info("玩家离开: table={}, role={}", tableId, role);
            broadcast(TableEvent.participantLeft(role));

            if (humanCount() == 0) {
                resetTable();
                log.info("牌桌已清空并重置: table={}", tableId);
            } else {
                refreshState();
            }
        } finally {
            lock.unlock();
        }
    }

    /** 关服：通知所有真人，棋盘保持原样 */
    public void shutdown() {
        lock.lock();
        try {
            log.info("牌桌关闭通知: table={}, humans={}", tableId, humanCount());
            broadcast(TableEvent.serverShutdown());
        } finally {
            lock.unlock();
        }
    }

    /**
     * 重开：仅在本盘已结束时允许。换新棋盘（黑先），广播 BOARD_STATE 并通知先手；AI 执黑时立即落子。
     *
     * @throws GameException NOT_SEATED / GAME_IN_PROGRESS
     */
    public void restart(Role role) {
        lock.lock();
        try {
            HumanSeat seat = humanAt(role);
            if (seat == null) {
                throw new GameException(GameErrorCode.NOT_SEATED, GameMessages.NOT_SEATED);
            }
            if (!outcome.isTerminal()) {
                throw fail(seat, GameErrorCode.GAME_IN_PROGRESS, GameMessages.GAME_IN_PROGRESS);
            }
            board = new Board();
            boardVersion++;
            outcome = Outcome.IN_PROGRESS;
            refreshState();
            log.info("重新开局: table={}, by={}, state={}", tableId, role, state);

            broadcast(TableEvent.boardState(board));
            if (state == TableState.IN_PLAY) {
                notifyTurn();
                advanceAi();
            }
        } finally {
            lock.unlock();
        }
    }

    /** 只读快照 */
    public TableSnapshot snapshot() {
        lock.lock();
        try {
            Role aiRole = null;
            for (Map.Entry<Role, Seat> e : seats.entrySet()) {
                if (e.getValue() instanceof AiSeat) aiRole = e.getKey();
            }
            return new TableSnapshot(tableId, state, board.rows(), board.currentTurn(),
                    displayNameOf(Role.BLACK), displayNameOf(Role.WHITE), aiRole, outcome, board.stoneCount());
        } finally {
            lock.unlock();
        }
    }

    /**
     * 给 role 一个落子建议（在棋盘副本上计算，不改变牌桌）。role 为 null 时取当前执子方。
     * 棋盘没变时直接返回上一次同一方的结果，不重复搜索。
     *
     * @throws GameException NO_LEGAL_MOVE 棋盘已满
     */
    public Move suggest(Role role) {
        Board copy;
        long version;
        lock.lock();
        try {
            copy = board.copy();
            version = boardVersion;
        } finally {
            lock.unlock();
        }
        Role side = role == null ? copy.currentTurn() : role;
        Hint cached = lastHint;
        if (cached != null && cached.boardVersion() == version && cached.side() == side) {
            return cached.move();
        }
        Move move = advisor.recommend(copy, side);
        lastHint = new Hint(version, side, move);
        return move;
    }

    public TableState state() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    /** 棋盘副本 */
    public Board board() {
        lock.lock();
        try {
            return board.copy();
        } finally {
            lock.unlock();
        }
    }

    // ================== 内部（调用方已持锁） ==================

    /** 落子后：推导结果并广播；终局进入 FINISHED */
    private void afterMove(Move move, Role role) {
        boardVersion++;
        outcome = Outcome.of(board);
        broadcast(TableEvent.moveApplied(move, role));
        broadcast(TableEvent.boardState(board));
        if (outcome.isTerminal()) {
            refreshState();
            log.info("对局结束: table={}, outcome={}, stones={}", tableId, outcome, board.stoneCount());
            broadcast(TableEvent.gameOver(outcome));
        } else {
            notifyTurn();
        }
    }

    /** 轮到 AI 时算出并落下它的应手；AI 失败只记录日志，牌桌保持原样 */
    private void advanceAi() {
        if (outcome.isTerminal()) return;
        Role turn = board.currentTurn();
        if (!(seats.get(turn) instanceof AiSeat ai)) return;
        try {
            Move move = ai.advisor().recommend(board.copy(), turn);
            board.place(move, turn);
            log.debug("AI 落子: table={}, role={}, move={}", tableId, turn, move);
            afterMove(move, turn);
        } catch (RuntimeException e) {
            log.error("AI 落子失败，牌桌保持原状: table={}, role={}", tableId, turn, e);
        }
    }

    /** 只通知持有当前轮次的真人 */
    private void notifyTurn() {
        Role turn = board.currentTurn();
        HumanSeat seat = humanAt(turn);
        if (seat != null) {
            seat.channel().deliver(TableEvent.turn(turn));
        }
    }

    private void broadcast(TableEvent event) {
        for (Seat s : seats.values()) {
            if (s instanceof HumanSeat h) {
                h.channel().deliver(event);
            }
        }
    }

    /** 给发起方推 ERROR，返回待抛出的异常 */
    private GameException fail(HumanSeat seat, GameErrorCode code, String message) {
        seat.channel().deliver(TableEvent.error(code.name(), message));
        return new GameException(code, message);
    }

    private void refreshState() {
        if (humanCount() == 0) {
            state = TableState.EMPTY;
        } else if (seats.size() < 2) {
            state = TableState.AWAITING_SECOND_PLAYER;
        } else if (outcome.isTerminal()) {
            state = TableState.FINISHED;
        } else {
            state = TableState.IN_PLAY;
        }
    }

    private void resetTable() {
        seats.clear();
        board = new Board();
        boardVersion++;
        outcome = Outcome.IN_PROGRESS;
        state = TableState.EMPTY;
    }

    private Role firstFreeRole() {
        for (Role r : Role.values()) {
            if (!(seats.get(r) instanceof HumanSeat)) return r;
        }
        return null;
    }

    private HumanSeat humanAt(Role role) {
        return role != null && seats.get(role) instanceof HumanSeat h ? h : null;
    }

    private int humanCount() {
        int n = 0;
        for (Seat s : seats.values()) {
            if (s instanceof HumanSeat) n++;
        }
        return n;
    }

    private String displayNameOf(Role role) {
        HumanSeat h = humanAt(role);
        return h == null ? null : h.displayName();
    }
}
