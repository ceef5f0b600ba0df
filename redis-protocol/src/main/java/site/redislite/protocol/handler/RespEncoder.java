package site.redislite.protocol.handler;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToByteEncoder;
import lombok.extern.slf4j.Slf4j;
import site.redislite.protocol.Resp;

/**
 * RESP协议编码器
 *
 * <p>把响应对象直接编码到Netty分配的输出缓冲区。
 *
 * @author hnfy258
 * @since 1.0.0
 */
@Slf4j
public class RespEncoder extends MessageToByteEncoder<Resp> {

    @Override
    protected void encode(final ChannelHandlerContext ctx, final Resp msg, final ByteBuf out) {
        msg.encode(out);
        log.debug("成功编码RESP响应: {} (大小: {} bytes)", msg.getClass().getSimpleName(), out.readableBytes());
    }
}
