package com.gomoku.tableservice.games.gomoku.interfaces.http;

import com.gomoku.tableservice.common.WebExceptionAdvice;
import com.gomoku.tableservice.games.gomoku.application.SessionCoordinator;
import com.gomoku.tableservice.games.gomoku.application.TableSnapshot;
import com.gomoku.tableservice.games.gomoku.application.TableState;
import com.gomoku.tableservice.games.gomoku.domain.constants.GameMessages;
import com.gomoku.tableservice.games.gomoku.domain.exception.GameErrorCode;
import com.gomoku.tableservice.games.gomoku.domain.exception.GameException;
import com.gomoku.tableservice.games.gomoku.domain.model.Board;
import com.gomoku.tableservice.games.gomoku.domain.model.Move;
import com.gomoku.tableservice.games.gomoku.domain.model.Role;
import com.gomoku.tableservice.games.gomoku.domain.rule.Outcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class TableRestControllerTest {

    private SessionCoordinator coordinator;
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        coordinator = mock(SessionCoordinator.class);
        mvc = MockMvcBuilders.standaloneSetup(new TableRestController(coordinator))
                .setControllerAdvice(new WebExceptionAdvice())
                .build();
    }

    @Test
    void snapshotIsWrappedInApiResponse() throws Exception {
        Board b = new Board();
        b.place(new Move(7, 7), Role.BLACK);
        when(coordinator.snapshot()).thenReturn(new TableSnapshot("main", TableState.IN_PLAY, b.rows(),
                b.currentTurn(), "alice", null, Role.WHITE, Outcome.IN_PROGRESS, 1));

        mvc.perform(get("/api/table"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(200))
                .andExpect(jsonPath("$.data.state").value("IN_PLAY"))
                .andExpect(jsonPath("$.data.grid.length()").value(15))
                .andExpect(jsonPath("$.data.grid[7]").value(".......X......."))
                .andExpect(jsonPath("$.data.currentTurn").value("WHITE"))
                .andExpect(jsonPath("$.data.aiRole").value("WHITE"))
                .andExpect(jsonPath("$.data.whitePlayer").doesNotExist());
    }

    @Test
    void hintAcceptsSymbolRole() throws Exception {
        when(coordinator.suggest(Role.WHITE)).thenReturn(new Move(6, 8));

        mvc.perform(get("/api/table/hint").param("role", "o"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.row").value(6))
                .andExpect(jsonPath("$.data.col").value(8));
    }

    @Test
    void unknownRoleIsBadRequest() throws Exception {
        mvc.perform(get("/api/table/hint").param("role", "purple"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value(400));
        verify(coordinator, never()).suggest(any());
    }

    @Test
    void fullBoardHintIsConflict() throws Exception {
        when(coordinator.suggest(Role.BLACK))
                .thenThrow(new GameException(GameErrorCode.NO_LEGAL_MOVE, GameMessages.NO_LEGAL_MOVE));

        mvc.perform(get("/api/table/hint").param("role", "BLACK"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value(409))
                .andExpect(jsonPath("$.message").value(GameMessages.NO_LEGAL_MOVE));
    }
}
