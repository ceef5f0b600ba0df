package site.redislite.server.handler;

import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.DecoderException;
import lombok.extern.slf4j.Slf4j;
import site.redislite.protocol.Resp;
import site.redislite.server.command.executor.CommandExecutor;

import java.io.IOException;

/**
 * 连接上的命令处理器，位于解码器和编码器之后。
 *
 * <p>运行在独立的 {@code EventExecutorGroup} 上，等待存储锁不会阻塞I/O线程。
 * 同一连接固定在一个执行线程上，回复顺序与请求顺序一致。
 *
 * @author hnfy258
 * @since 1.0
 */
@Slf4j
public class RespCommandHandler extends SimpleChannelInboundHandler<Resp> {

    private final CommandExecutor commandExecutor;

    public RespCommandHandler(final CommandExecutor commandExecutor) {
        if (commandExecutor == null) {
            throw new IllegalArgumentException("CommandExecutor不能为null");
        }
        this.commandExecutor = commandExecutor;
    }

    @Override
    public void channelActive(final ChannelHandlerContext ctx) throws Exception {
        log.debug("客户端连接: {}", ctx.channel().remoteAddress());
        super.channelActive(ctx);
    }

    @Override
    protected void channelRead0(final ChannelHandlerContext ctx, final Resp msg) {
        final Resp response = commandExecutor.execute(msg);
        writeResponseDirectly(ctx, response);
    }

    private void writeResponseDirectly(final ChannelHandlerContext ctx, final Resp response) {
        if (!ctx.channel().isActive()) {
            log.debug("Channel 已关闭，跳过响应发送");
            return;
        }
        ctx.writeAndFlush(response);
    }

    @Override
    public void exceptionCaught(final ChannelHandlerContext ctx, final Throwable cause) {
        if (cause instanceof DecoderException) {
            log.warn("协议错误，关闭连接 {}: {}", ctx.channel().remoteAddress(), cause.getMessage());
        } else if (cause instanceof IOException) {
            log.warn("连接I/O异常，关闭连接 {}: {}", ctx.channel().remoteAddress(), cause.getMessage());
        } else {
            log.error("连接异常，关闭连接 {}", ctx.channel().remoteAddress(), cause);
        }
        ctx.close();
    }

    @Override
    public void channelInactive(final ChannelHandlerContext ctx) {
        log.debug("客户端断开: {}", ctx.channel().remoteAddress());
        ctx.fireChannelInactive();
    }
}
