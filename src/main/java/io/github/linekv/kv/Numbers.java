package io.github.linekv.kv;

import com.google.common.base.CharMatcher;

import java.util.Optional;

/**
 * 十进制整数解析。
 *
 * @author zy
 */
public final class Numbers {
    private static final CharMatcher ASCII_DIGIT = CharMatcher.inRange('0', '9');

    private Numbers() {
    }

    /**
     * 解析有符号64位十进制整数，只接受可选的'+'或'-'后跟ASCII数字。
     * {@link Long#parseLong(String)}会接受其他文字的数字，这里不接受。
     *
     * @param text 待解析的文本
     * @return 解析结果，格式错误或超出范围时为空
     */
    public static Optional<Long> parseLong(String text) {
        if (text == null) {
            return Optional.empty();
        }
        String digits = text.startsWith("+") || text.startsWith("-") ? text.substring(1) : text;
        if (digits.isEmpty() || !ASCII_DIGIT.matchesAllOf(digits)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Long.parseLong(text));
        } catch (NumberFormatException e) {
            // 超出long范围
            return Optional.empty();
        }
    }
}
