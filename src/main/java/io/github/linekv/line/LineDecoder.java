package io.github.linekv.line;

import com.google.common.base.Preconditions;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * 按'\n'切分的行协议解码器，使用{@link LineBuffer}缓存不完整的行。
 * 行尾的'\r'会被去掉。一次decode可能解出零到多行，使用{@link #get()}按顺序取出。
 *
 * @author zy
 */
public class LineDecoder {
    public static final int DEFAULT_MAX_LINE_LENGTH = 64 * 1024;

    private final LineBuffer buffer = LineBuffer.allocate(512);
    private final Deque<String> lines = new ArrayDeque<>();
    private final int maxLineLength;

    public LineDecoder() {
        this(DEFAULT_MAX_LINE_LENGTH);
    }

    public LineDecoder(int maxLineLength) {
        Preconditions.checkArgument(maxLineLength > 0);
        this.maxLineLength = maxLineLength;
    }

    public static LineDecoder create() {
        return new LineDecoder();
    }

    /**
     * @param bb 新收到的数据
     * @return 本对象
     * @throws LineTooLongException 出现超过最大长度的行，超长行之前的完整行仍然可以用{@link #get()}取出
     */
    public LineDecoder decode(ByteBuffer bb) throws LineTooLongException {
        buffer.writeBytes(bb);
        decode0();
        return this;
    }

    public LineDecoder decode(byte[] bytes) throws LineTooLongException {
        buffer.writeBytes(bytes);
        decode0();
        return this;
    }

    private void decode0() throws LineTooLongException {
        for (; ; ) {
            int i = buffer.indexOf((byte) '\n');
            if (i == -1) {
                break;
            }
            if (i > maxLineLength) {
                throw new LineTooLongException(i, maxLineLength);
            }
            byte[] bytes = buffer.readBytes(i);
            buffer.skipBytes(1);
            int len = bytes.length;
            if (len > 0 && bytes[len - 1] == '\r') {
                len--;
            }
            lines.add(new String(bytes, 0, len, StandardCharsets.UTF_8));
        }
        if (buffer.readableBytes() > maxLineLength) {
            throw new LineTooLongException(buffer.readableBytes(), maxLineLength);
        }
        buffer.discardReadBytes();
    }

    /**
     * @return 下一行，没有完整的行时返回null
     */
    public String get() {
        return lines.poll();
    }

    public boolean hasLine() {
        return !lines.isEmpty();
    }
}
