package io.github.linekv.server;

import io.github.linekv.command.Session;
import io.github.linekv.line.LineDecoder;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;

import java.nio.ByteBuffer;
import java.nio.channels.AsynchronousSocketChannel;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 客户连接channel上挂载的附件对象，包含{@link LineReadHandler read handler}和{@link LineWriteHandler write handler}。
 * 同一连接任何时刻只有一个读或写在进行，附件不会被并发访问。
 *
 * @author zy
 */
public class ConnectionAttachment {
    // 相关socket channel
    @Getter
    private final AsynchronousSocketChannel channel;
    // 读缓冲区，连接存活期间复用
    @Getter
    private final ByteBuffer readBuffer;
    // 行协议decoder，保存跨多次读取的半行数据
    @Getter
    private final LineDecoder decoder;
    // 连接会话
    @Getter
    private final Session session;
    @Getter
    private final LineReadHandler readHandler;
    @Getter
    private final LineWriteHandler writeHandler;
    // 正在写出的应答
    @Getter
    @Setter(AccessLevel.PACKAGE)
    private ByteBuffer writeBuffer;
    // 应答写完后关闭连接
    @Getter
    @Setter(AccessLevel.PACKAGE)
    private boolean closeAfterWrite;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    ConnectionAttachment(AsynchronousSocketChannel channel,
                         Session session,
                         int bufferSize,
                         int maxLineLength,
                         LineReadHandler readHandler,
                         LineWriteHandler writeHandler) {
        this.channel = channel;
        this.session = session;
        this.readBuffer = ByteBuffer.allocate(bufferSize);
        this.decoder = new LineDecoder(maxLineLength);
        this.readHandler = readHandler;
        this.writeHandler = writeHandler;
    }

    /**
     * @return 第一次调用返回true，之后返回false
     */
    boolean markClosed() {
        return closed.compareAndSet(false, true);
    }

    public boolean isClosed() {
        return closed.get();
    }

    void read() {
        readBuffer.clear();
        channel.read(readBuffer, this, readHandler);
    }

    void write(ByteBuffer buffer, boolean closeAfterWrite) {
        this.writeBuffer = buffer;
        this.closeAfterWrite = closeAfterWrite;
        channel.write(buffer, this, writeHandler);
    }
}
