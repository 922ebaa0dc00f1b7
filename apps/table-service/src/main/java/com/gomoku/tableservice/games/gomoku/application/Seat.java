package com.gomoku.tableservice.games.gomoku.application;

import com.gomoku.tableservice.games.gomoku.application.channel.ParticipantChannel;
import com.gomoku.tableservice.games.gomoku.domain.ai.MoveAdvisor;

/**
 * 座位：一个执子方要么由真人持有，要么由 AI 持有，二者互斥。
 */
public interface Seat {

    /** 真人座位：事件经 channel 推送 */
    record HumanSeat(ParticipantChannel channel, String displayName) implements Seat { }

    /** AI 座位：轮到它时由协调器在同一把锁内直接调用 advisor */
    record AiSeat(MoveAdvisor advisor) implements Seat { }
}
