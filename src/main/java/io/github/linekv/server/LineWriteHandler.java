package io.github.linekv.server;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.channels.CompletionHandler;

/**
 * 将应答中的buffer数据全部返回给客户端，然后继续读或者关闭连接。
 *
 * @author zy
 */
public class LineWriteHandler implements CompletionHandler<Integer, ConnectionAttachment> {
    private static final Logger logger = LoggerFactory.getLogger(LineWriteHandler.class);

    @Override
    public void completed(Integer result, ConnectionAttachment attachment) {
        if (attachment.getWriteBuffer().hasRemaining()) {
            attachment.getChannel().write(attachment.getWriteBuffer(), attachment, this);
        } else if (attachment.isCloseAfterWrite()) {
            attachment.getReadHandler().close(attachment);
        } else {
            attachment.setWriteBuffer(null);
            attachment.read();
        }
    }

    @Override
    public void failed(Throwable exc, ConnectionAttachment attachment) {
        if (!attachment.isClosed()) {
            logger.error("write handler failed.", exc);
        }
        attachment.getReadHandler().close(attachment);
    }
}
