package com.chesshub.chessservice.common;

import com.chesshub.chessservice.games.chess.domain.exception.ChessGameException;
import com.chesshub.chessservice.games.chess.domain.exception.ErrorKind;
import com.chesshub.web.common.ApiResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * 全局异常映射处理器。
 */
@Slf4j
@RestControllerAdvice
public class WebExceptionAdvice {

    /**
     * 对局业务异常：
     * GAME_NOT_FOUND → 404；NOT_A_PLAYER → 403；满员/已开始/已结束 → 409；其余 → 400。
     * @param e 业务异常
     * @return 对应状态码，响应体为异常信息
     */
    @ExceptionHandler(ChessGameException.class)
    public ResponseEntity<ApiResponse<Object>> chessGame(ChessGameException e) {
        ErrorKind kind = e.getKind();
        if (kind == ErrorKind.GAME_NOT_FOUND) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ApiResponse.notFound(e.getMessage()));
        }
        if (kind == ErrorKind.NOT_A_PLAYER) {
            return ResponseEntity.status(HttpStatus.FORBIDDEN).body(ApiResponse.forbidden(e.getMessage()));
        }
        if (kind.isConflict()) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(ApiResponse.conflict(e.getMessage()));
        }
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ApiResponse.badRequest(e.getMessage()));
    }

    /**
     * 处理参数不合法异常（IllegalArgumentException）。
     * 该异常通常出现在 Controller 层的参数校验失败时，例如玩家名清洗后为空。
     * @param e 参数非法异常
     * @return HTTP 400（Bad Request），响应体为异常信息
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiResponse<Object>> badRequest(IllegalArgumentException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ApiResponse.badRequest(e.getMessage()));
    }

    /** 请求体不是合法 JSON */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiResponse<Object>> unreadable(HttpMessageNotReadableException e) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ApiResponse.badRequest("Malformed request body"));
    }

    /**
     * 兜底：持久化或内部错误，记录堆栈，只返回通用信息。
     */
    @ExceptionHandler(RuntimeException.class)
    public ResponseEntity<ApiResponse<Object>> serverError(RuntimeException e) {
        log.error("unhandled request failure", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ApiResponse.serverError("Internal server error"));
    }
}
