package com.gomoku.tableservice.games.gomoku.interfaces.http;

import com.gomoku.tableservice.common.ApiResponse;
import com.gomoku.tableservice.games.gomoku.application.SessionCoordinator;
import com.gomoku.tableservice.games.gomoku.application.TableSnapshot;
import com.gomoku.tableservice.games.gomoku.domain.model.Move;
import com.gomoku.tableservice.games.gomoku.domain.model.Role;
import lombok.RequiredArgsConstructor;
import org.apache.commons.lang3.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * 牌桌只读接口：观战/调试用，不改变牌桌。
 */
@RestController
@RequestMapping("/api/table")
@RequiredArgsConstructor
public class TableRestController {

    private final SessionCoordinator coordinator;

    /** 当前牌桌快照 */
    @GetMapping
    public ApiResponse<TableSnapshot> snapshot() {
        return ApiResponse.success(coordinator.snapshot());
    }

    /**
     * AI 落子建议。role 可空（取当前执子方），接受 BLACK/WHITE 或 X/O。
     */
    @GetMapping("/hint")
    public ApiResponse<Move> hint(@RequestParam(value = "role", required = false) String role) {
        Role side = StringUtils.isBlank(role) ? null : Role.parse(role);
        return ApiResponse.success(coordinator.suggest(side));
    }
}
