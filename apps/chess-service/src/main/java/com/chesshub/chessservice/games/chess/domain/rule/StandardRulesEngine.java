package com.chesshub.chessservice.games.chess.domain.rule;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * 标准国际象棋规则实现
 * ----------------------------------------
 * - 合法性：伪合法走法生成 + 走后己方王不被攻击；
 * - 记谱：SAN（含歧义消解、吃子 x、升变 =Q、将军 + / 将死 #、易位 O-O / O-O-O）；
 * - 判定优先级：将死/逼和 → 子力不足 → 三次重复 → 五十回合 → 将军。
 */
@Component
public class StandardRulesEngine implements RulesEngine {

    @Override
    public ChessPosition initialPosition() {
        return ChessPosition.initial();
    }

    @Override
    public ChessPosition fromFen(String fen) {
        return ChessPosition.fromFen(fen);
    }

    @Override
    public Optional<AppliedMove> applyMove(ChessPosition position, String from, String to, String promotion) {
        if (!Squares.isValid(from) || !Squares.isValid(to)) {
            return Optional.empty();
        }
        char promo = (promotion == null || promotion.isBlank())
                ? 'q'
                : Character.toLowerCase(promotion.trim().charAt(0));

        int fromIdx = Squares.index(from);
        int toIdx = Squares.index(to);
        List<LegalMove> legal = MoveGenerator.legalMoves(position);

        LegalMove chosen = null;
        for (LegalMove m : legal) {
            if (m.from() != fromIdx || m.to() != toIdx) continue;
            // 非升变走法忽略 promotion 参数
            if (m.promotion() == 0 || m.promotion() == promo) {
                chosen = m;
                break;
            }
        }
        if (chosen == null) {
            return Optional.empty();
        }

        String sanBody = sanWithoutSuffix(chosen, legal);
        position.play(chosen);
        Classification after = classify(position);
        String san = sanBody + (after.kind() == Classification.Kind.CHECKMATE ? "#" : after.inCheck() ? "+" : "");

        return Optional.of(new AppliedMove(
                from,
                to,
                chosen.promotion() == 0 ? null : String.valueOf(chosen.promotion()),
                san,
                String.valueOf(Character.toLowerCase(chosen.piece())),
                chosen.captured() == 0 ? null : String.valueOf(Character.toLowerCase(chosen.captured())),
                position.toFen()));
    }

    @Override
    public List<LegalMove> legalMoves(ChessPosition position) {
        return MoveGenerator.legalMoves(position);
    }

    @Override
    public Classification classify(ChessPosition position) {
        boolean inCheck = MoveGenerator.inCheck(position);
        if (MoveGenerator.legalMoves(position).isEmpty()) {
            return inCheck ? Classification.checkmate() : Classification.stalemate();
        }
        if (insufficientMaterial(position)) {
            return Classification.draw(Classification.INSUFFICIENT_MATERIAL);
        }
        if (isThreefoldRepetition(position)) {
            return Classification.draw(Classification.THREEFOLD);
        }
        if (position.halfmoveClock() >= 100) {
            return Classification.draw(Classification.FIFTY_MOVE);
        }
        return inCheck ? Classification.check() : Classification.none();
    }

    // ----------- SAN -----------

    private static String sanWithoutSuffix(LegalMove m, List<LegalMove> legal) {
        if (m.isCastleKingside()) return "O-O";
        if (m.isCastleQueenside()) return "O-O-O";

        char kind = Character.toLowerCase(m.piece());
        StringBuilder sb = new StringBuilder(8);
        if (kind == 'p') {
            if (m.isCapture()) {
                sb.append(m.fromSquare().charAt(0)).append('x');
            }
            sb.append(m.toSquare());
            if (m.promotion() != 0) {
                sb.append('=').append(Character.toUpperCase(m.promotion()));
            }
            return sb.toString();
        }

        sb.append(Character.toUpperCase(kind));
        sb.append(disambiguation(m, legal));
        if (m.isCapture()) sb.append('x');
        sb.append(m.toSquare());
        return sb.toString();
    }

    /**
     * 同类棋子可走到同一格时的起点标注：优先文件字母，其次行号，都不够则完整格名。
     */
    private static String disambiguation(LegalMove m, List<LegalMove> legal) {
        boolean ambiguous = false;
        boolean sameFile = false;
        boolean sameRank = false;
        for (LegalMove other : legal) {
            if (other.from() == m.from() || other.to() != m.to() || other.piece() != m.piece()) continue;
            ambiguous = true;
            if (Squares.file(other.from()) == Squares.file(m.from())) sameFile = true;
            if (Squares.rank(other.from()) == Squares.rank(m.from())) sameRank = true;
        }
        if (!ambiguous) return "";
        String square = m.fromSquare();
        if (!sameFile) return square.substring(0, 1);
        if (!sameRank) return square.substring(1);
        return square;
    }

    // ----------- 和棋判定 -----------

    /**
     * 子力不足：王对王；王+单马/单象对王；除王外全是象且都在同色格。
     */
    static boolean insufficientMaterial(ChessPosition p) {
        int others = 0;
        int minors = 0;
        int bishops = 0;
        int bishopsOnDark = 0;
        for (int sq = 0; sq < 64; sq++) {
            char c = Character.toLowerCase(p.pieceAt(sq));
            if (c == ChessPosition.EMPTY || c == 'k') continue;
            others++;
            if (c == 'n' || c == 'b') minors++;
            if (c == 'b') {
                bishops++;
                if ((Squares.file(sq) + Squares.rank(sq)) % 2 == 0) bishopsOnDark++;
            }
        }
        if (others == 0) return true;
        if (others == 1 && minors == 1) return true;
        return others == bishops && (bishopsOnDark == 0 || bishopsOnDark == bishops);
    }

    private static boolean isThreefoldRepetition(ChessPosition p) {
        List<String> history = p.history();
        if (history.isEmpty()) return false;
        String current = history.get(history.size() - 1);
        int seen = 0;
        for (String key : history) {
            if (key.equals(current) && ++seen >= 3) return true;
        }
        return false;
    }
}
