package io.github.linekv.command;

import io.github.linekv.line.LineArray;
import io.github.linekv.line.LineData;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

/**
 * 一行命令的处理结果：要写回的应答，以及写完后是否关闭连接。
 *
 * @author zy
 */
@EqualsAndHashCode
@ToString
public class DispatchResult {
    private static final DispatchResult NONE = new DispatchResult(LineArray.empty(), false);
    private static final DispatchResult CLOSE = new DispatchResult(LineArray.empty(), true);

    @Getter
    private final LineData reply;
    @Getter
    private final boolean close;

    private DispatchResult(LineData reply, boolean close) {
        this.reply = reply;
        this.close = close;
    }

    public static DispatchResult reply(@NonNull LineData reply) {
        return new DispatchResult(reply, false);
    }

    /**
     * 空行，不需要应答。
     */
    public static DispatchResult none() {
        return NONE;
    }

    public static DispatchResult close() {
        return CLOSE;
    }
}
