package site.redislite.protocol.handler;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ByteToMessageDecoder;
import lombok.extern.slf4j.Slf4j;
import site.redislite.protocol.Resp;
import site.redislite.protocol.RespProtocolException;

import java.util.List;

/**
 * RESP协议解码器
 *
 * <p>基于Netty的ByteToMessageDecoder，把累积缓冲区中的字节流解码为 {@link Resp} 对象。
 *
 * <p>错误处理：
 * <ul>
 *     <li>数据不完整 - 保留已收到的字节，等待下一次读事件</li>
 *     <li>格式错误 - 抛出 {@link RespProtocolException}，之后丢弃该连接的所有输入</li>
 *     <li>对端在两条命令之间关闭 - 正常断开，不产生异常</li>
 *     <li>对端在一条命令中途关闭 - 视为格式错误</li>
 * </ul>
 *
 * @author hnfy258
 * @since 1.0.0
 */
@Slf4j
public class RespDecoder extends ByteToMessageDecoder {

    /** 出现过格式错误后不再解码 */
    private boolean failed;

    @Override
    protected void decode(final ChannelHandlerContext ctx, final ByteBuf in, final List<Object> out) {
        if (failed) {
            in.skipBytes(in.readableBytes());
            return;
        }

        try {
            final Resp resp = Resp.decode(in);
            if (resp != null) {
                out.add(resp);
                log.debug("成功解码RESP对象: {}", resp.getClass().getSimpleName());
            }
        } catch (RespProtocolException e) {
            failed = true;
            in.skipBytes(in.readableBytes());
            throw e;
        }
    }

    @Override
    protected void decodeLast(final ChannelHandlerContext ctx, final ByteBuf in, final List<Object> out) throws Exception {
        super.decodeLast(ctx, in, out);
        if (in.isReadable() && !failed) {
            final int remaining = in.readableBytes();
            failed = true;
            in.skipBytes(remaining);
            throw new RespProtocolException("协议错误：连接在消息传输中途关闭，剩余 " + remaining + " 字节未解码");
        }
    }
}
