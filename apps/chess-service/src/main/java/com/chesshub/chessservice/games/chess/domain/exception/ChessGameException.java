package com.chesshub.chessservice.games.chess.domain.exception;

import lombok.Getter;

/**
 * 调用方可预期的对局业务异常（非法走子、轮次不对、对局已满等）。
 * 持久化/规则引擎故障不走这里，按原始异常向上抛。
 */
@Getter
public class ChessGameException extends RuntimeException {

    private final ErrorKind kind;

    public ChessGameException(ErrorKind kind) {
        this(kind, kind.defaultMessage());
    }

    public ChessGameException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }
}
