package com.chesshub.chessservice.games.chess.domain.rule;

import java.util.List;
import java.util.Optional;

/**
 * 国际象棋规则能力（对局核心只调用，不自行推导规则）
 * ----------------------------------------
 * 每次调用无状态；局面对象由调用方持有并传入。
 * 任何满足该契约的实现都可以作为 Spring Bean 替换默认实现。
 */
public interface RulesEngine {

    /** 标准开局局面 */
    ChessPosition initialPosition();

    /** 从 FEN 恢复局面（冷启动恢复对局用） */
    ChessPosition fromFen(String fen);

    /**
     * 尝试在给定局面上走一步；合法则原地推进局面并返回结果，否则返回 empty 且局面不变。
     *
     * @param promotion 升变子（"q"/"r"/"b"/"n"），可空；兵到底线且未指定时默认升后
     */
    Optional<AppliedMove> applyMove(ChessPosition position, String from, String to, String promotion);

    /** 当前行棋方的全部合法走法 */
    List<LegalMove> legalMoves(ChessPosition position);

    /** 终局/将军判定 */
    Classification classify(ChessPosition position);
}
