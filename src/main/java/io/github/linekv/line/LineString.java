package io.github.linekv.line;

import com.google.common.base.Preconditions;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.nio.charset.StandardCharsets;

/**
 * 单行应答。
 *
 * @author zy
 */
@EqualsAndHashCode
@ToString
public class LineString implements LineData {
    private static final LineString OK = new LineString("OK");
    private static final LineString QUEUED = new LineString("QUEUED");
    private static final LineString NIL = new LineString("(nil)");

    @Getter
    private final String content;

    private LineString(String content) {
        Preconditions.checkNotNull(content);
        Preconditions.checkArgument(!content.contains("\r"), "line string不能包含\\r");
        Preconditions.checkArgument(!content.contains("\n"), "line string不能包含\\n");
        this.content = content;
    }

    public static LineString with(String content) {
        return new LineString(content);
    }

    public static LineString ok() {
        return OK;
    }

    public static LineString queued() {
        return QUEUED;
    }

    public static LineString nil() {
        return NIL;
    }

    public static LineString integer(long n) {
        return new LineString("(integer) " + n);
    }

    /**
     * 用双引号包裹并转义，结果中不会出现原始的控制字符。
     * 常见控制字符转义为\n、\t、\a、\b、\f、\v，其余C0控制字符和DEL转义为\xNN，C1控制字符转义为u加四位十六进制。
     *
     * @param value 原始值
     * @return 应答
     */
    public static LineString quoted(String value) {
        return new LineString(quote(value));
    }

    static String quote(String value) {
        StringBuilder sb = new StringBuilder(value.length() + 2);
        sb.append('"');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '"':
                    sb.append("\\\"");
                    break;
                case '\\':
                    sb.append("\\\\");
                    break;
                case '\n':
                    sb.append("\\n");
                    break;
                case '\r':
                    sb.append("\\r");
                    break;
                case '\t':
                    sb.append("\\t");
                    break;
                case 0x07:
                    sb.append("\\a");
                    break;
                case '\b':
                    sb.append("\\b");
                    break;
                case '\f':
                    sb.append("\\f");
                    break;
                case 0x0b:
                    sb.append("\\v");
                    break;
                default:
                    if (c < 0x20 || c == 0x7f) {
                        sb.append(String.format("\\x%02x", (int) c));
                    } else if (Character.isISOControl(c)) {
                        sb.append(String.format("\\u%04x", (int) c));
                    } else {
                        sb.append(c);
                    }
            }
        }
        return sb.append('"').toString();
    }

    @Override
    public byte[] toBytes() {
        return (content + "\n").getBytes(StandardCharsets.UTF_8);
    }
}
