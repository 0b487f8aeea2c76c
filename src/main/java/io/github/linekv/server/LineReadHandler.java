package io.github.linekv.server;

import io.github.linekv.command.DispatchResult;
import io.github.linekv.line.LineString;
import io.github.linekv.line.LineTooLongException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.CompletionHandler;

/**
 * 读取客户请求，按行处理后使用{@link LineWriteHandler writer}一次写回本次读到的所有行的应答。
 * 写完以后再发起下一次读，所以同一连接的命令严格按顺序处理。
 *
 * @author zy
 */
public abstract class LineReadHandler implements CompletionHandler<Integer, ConnectionAttachment> {
    private static final Logger logger = LoggerFactory.getLogger(LineReadHandler.class);

    @Override
    public void completed(Integer result, ConnectionAttachment attachment) {
        if (result == -1) {
            logger.debug("connection {} closed by peer.", attachment.getSession().getRemote());
            close(attachment);
            return;
        }

        ByteBuffer buffer = attachment.getReadBuffer();
        boolean tooLong = false;
        try {
            buffer.flip();
            attachment.getDecoder().decode(buffer);
        } catch (LineTooLongException e) {
            // 超长行之前已经完整的行照常处理并应答，然后关闭连接
            logger.warn("connection {} sent a line too long, closing.", attachment.getSession().getRemote(), e);
            tooLong = true;
        }

        ByteArrayOutputStream response = new ByteArrayOutputStream();
        boolean closing = tooLong;
        String line;
        while ((line = attachment.getDecoder().get()) != null) {
            DispatchResult result0;
            try {
                result0 = process(attachment, line);
            } catch (RuntimeException e) {
                logger.error("read handler exception in completed().", e);
                result0 = DispatchResult.reply(LineString.with("ERR internal error: " + e.getClass().getName()));
            }
            response.writeBytes(result0.getReply().toBytes());
            if (result0.isClose()) {
                closing = true;
                break;
            }
        }

        if (response.size() > 0) {
            attachment.write(ByteBuffer.wrap(response.toByteArray()), closing);
        } else if (closing) {
            close(attachment);
        } else {
            attachment.read();
        }
    }

    @Override
    public void failed(Throwable exc, ConnectionAttachment attachment) {
        if (!attachment.isClosed()) {
            logger.error("read handler failed.", exc);
        }
        close(attachment);
    }

    /**
     * 关闭连接，只有第一次调用生效。
     *
     * @param attachment 连接附件
     */
    void close(ConnectionAttachment attachment) {
        if (!attachment.markClosed()) {
            return;
        }
        try {
            attachment.getChannel().close();
        } catch (IOException e) {
            logger.warn("close channel failed.", e);
        } finally {
            closed(attachment);
        }
    }

    /**
     * 处理一行请求。
     *
     * @param attachment 连接附件
     * @param line       不含换行符的一行
     * @return 处理结果
     */
    protected abstract DispatchResult process(ConnectionAttachment attachment, String line);

    /**
     * 连接关闭后回调，用于清理会话状态。
     *
     * @param attachment 连接附件
     */
    protected abstract void closed(ConnectionAttachment attachment);
}
