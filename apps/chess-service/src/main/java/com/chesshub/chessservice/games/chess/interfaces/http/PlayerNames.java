package com.chesshub.chessservice.games.chess.interfaces.http;

import com.chesshub.chessservice.games.chess.domain.constants.GameMessages;
import org.apache.commons.lang3.StringUtils;

import java.util.regex.Pattern;

/**
 * 玩家名清洗：去首尾空白 → 截断到 30 字符 → 只保留字母、数字、空格、下划线、连字符。
 * 清洗后为空视为非法。
 */
public final class PlayerNames {

    public static final int MAX_LENGTH = 30;

    private static final Pattern DISALLOWED = Pattern.compile("[^A-Za-z0-9 _\\-]");

    private PlayerNames() {}

    /**
     * @throws IllegalArgumentException 名字为空或清洗后为空
     */
    public static String sanitize(String raw) {
        String trimmed = StringUtils.left(StringUtils.trimToEmpty(raw), MAX_LENGTH);
        String cleaned = DISALLOWED.matcher(trimmed).replaceAll("");
        if (cleaned.isEmpty()) {
            throw new IllegalArgumentException(GameMessages.INVALID_NAME);
        }
        return cleaned;
    }
}
