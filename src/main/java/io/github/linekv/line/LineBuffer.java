package io.github.linekv.line;

import com.google.common.base.Preconditions;
import lombok.Getter;

import java.nio.ByteBuffer;
import java.util.Arrays;

/**
 * 读写位置相互独立的字节缓冲区，不用考虑{@link ByteBuffer}的flip和rewind。
 * 已读过的数据在{@link #discardReadBytes()}时回收，连接存活期间缓冲区可以一直复用。
 *
 * @author zy
 */
public class LineBuffer {
    // 底层字节数组
    private byte[] buf;
    // 当前读位置
    @Getter
    private int readerIndex;
    // 当前写位置
    @Getter
    private int writerIndex;

    private LineBuffer(int capacity) {
        Preconditions.checkArgument(capacity > 0, "capacity must be positive");
        buf = new byte[capacity];
    }

    public static LineBuffer allocate(int capacity) {
        return new LineBuffer(capacity);
    }

    /**
     * 写入{@code bb}中剩余的全部数据，空间不足时扩容。
     *
     * @param bb 数据源
     * @return 本对象
     */
    public LineBuffer writeBytes(ByteBuffer bb) {
        int n = bb.remaining();
        ensureWritable(n);
        bb.get(buf, writerIndex, n);
        writerIndex += n;
        return this;
    }

    public LineBuffer writeBytes(byte[] bytes) {
        ensureWritable(bytes.length);
        System.arraycopy(bytes, 0, buf, writerIndex, bytes.length);
        writerIndex += bytes.length;
        return this;
    }

    public boolean isReadable() {
        return readerIndex < writerIndex;
    }

    public int readableBytes() {
        return writerIndex - readerIndex;
    }

    public int writableBytes() {
        return buf.length - writerIndex;
    }

    public int capacity() {
        return buf.length;
    }

    /**
     * 读出{@code length}个字节。
     *
     * @param length 长度
     * @return 数据
     * @throws IndexOutOfBoundsException 可读数据不足
     */
    public byte[] readBytes(int length) {
        if (length > readableBytes()) {
            throw new IndexOutOfBoundsException("readable " + readableBytes() + " < " + length);
        }
        byte[] bytes = Arrays.copyOfRange(buf, readerIndex, readerIndex + length);
        readerIndex += length;
        return bytes;
    }

    /**
     * 跳过{@code length}个字节。
     *
     * @param length 长度
     * @return 本对象
     */
    public LineBuffer skipBytes(int length) {
        Preconditions.checkState(length <= readableBytes());
        readerIndex += length;
        return this;
    }

    /**
     * 在可读区域中查找字节。
     *
     * @param value 字节值
     * @return 从readerIndex开始的相对偏移，没有找到返回-1
     */
    public int indexOf(byte value) {
        for (int i = readerIndex; i < writerIndex; i++) {
            if (buf[i] == value) {
                return i - readerIndex;
            }
        }
        return -1;
    }

    /**
     * 把未读数据移动到数组头部，回收已读空间。
     */
    public void discardReadBytes() {
        if (readerIndex == 0) {
            return;
        }
        int readable = readableBytes();
        System.arraycopy(buf, readerIndex, buf, 0, readable);
        readerIndex = 0;
        writerIndex = readable;
    }

    private void ensureWritable(int length) {
        if (writableBytes() >= length) {
            return;
        }
        discardReadBytes();
        if (writableBytes() < length) {
            buf = Arrays.copyOf(buf, Math.max(buf.length * 2, writerIndex + length));
        }
    }
}
