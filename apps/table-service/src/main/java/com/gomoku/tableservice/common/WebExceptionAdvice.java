package com.gomoku.tableservice.common;

import com.gomoku.tableservice.games.gomoku.domain.exception.GameException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * 全局异常映射处理器。
 */
@Slf4j
@RestControllerAdvice
public class WebExceptionAdvice {

    /**
     * 对局业务异常：请求参数本身有问题映射为 400，其余（牌桌状态冲突）映射为 409。
     */
    @ExceptionHandler(GameException.class)
    public ResponseEntity<ApiResponse<Object>> gameError(GameException e) {
        HttpStatus status = e.getCode().isClientInput() ? HttpStatus.BAD_REQUEST : HttpStatus.CONFLICT;
        log.debug("请求失败: code={}, status={}", e.getCode(), status.value());
        return ResponseEntity.status(status).body(ApiResponse.error(status.value(), e.getMessage()));
    }

    /** 参数不合法（如无法识别的执子方） */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiResponse<Object>> badRequest(IllegalArgumentException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ApiResponse.badRequest(e.getMessage()));
    }

    /** 非法状态 */
    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ApiResponse<Object>> conflict(IllegalStateException e) {
        return ResponseEntity.status(HttpStatus.CONFLICT).body(ApiResponse.conflict(e.getMessage()));
    }
}
