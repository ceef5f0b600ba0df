package site.redislite.server;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.ServerChannel;
import io.netty.channel.epoll.Epoll;
import io.netty.channel.epoll.EpollEventLoopGroup;
import io.netty.channel.epoll.EpollServerSocketChannel;
import io.netty.channel.kqueue.KQueue;
import io.netty.channel.kqueue.KQueueEventLoopGroup;
import io.netty.channel.kqueue.KQueueServerSocketChannel;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.util.concurrent.DefaultEventExecutorGroup;
import io.netty.util.concurrent.DefaultThreadFactory;
import io.netty.util.concurrent.EventExecutorGroup;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import site.redislite.core.RedisCore;
import site.redislite.core.RedisCoreImpl;
import site.redislite.protocol.handler.RespDecoder;
import site.redislite.protocol.handler.RespEncoder;
import site.redislite.server.command.executor.CommandExecutor;
import site.redislite.server.config.RedisServerConfig;
import site.redislite.server.handler.RespCommandHandler;

import java.net.InetSocketAddress;

/**
 * 基于Netty的Redis服务器实现
 *
 * <p>线程模型：
 * <ul>
 *   <li>boss线程组接受连接，worker线程组负责读写和编解码
 *   <li>命令在独立的 {@link DefaultEventExecutorGroup} 上执行，
 *       同一连接的命令始终由同一个线程按顺序处理
 *   <li>所有连接共享一个 {@link RedisCore}
 * </ul>
 *
 * <p>优先使用Epoll或KQueue原生传输，不可用时退回NIO。
 *
 * @author hnfy258
 * @since 1.0
 */
@Slf4j
public class RedisMiniServer implements RedisServer {

    @Getter
    private final RedisServerConfig config;

    private Class<? extends ServerChannel> serverChannelClass;

    private EventLoopGroup bossGroup;

    private EventLoopGroup workerGroup;

    private EventExecutorGroup commandExecutorGroup;

    private volatile Channel serverChannel;

    private final RedisCore redisCore;

    private final CommandExecutor commandExecutor;

    public RedisMiniServer(final RedisServerConfig config) {
        this(config, new RedisCoreImpl(config.toSnapshotConfig()));
    }

    /**
     * 构造函数
     *
     * @param config    服务器配置
     * @param redisCore 共享存储
     */
    public RedisMiniServer(final RedisServerConfig config, final RedisCore redisCore) {
        config.validate();
        this.config = config;
        this.redisCore = redisCore;
        this.commandExecutor = new CommandExecutor(redisCore);

        initializeEventLoopGroups();
        this.commandExecutorGroup = new DefaultEventExecutorGroup(config.getCommandExecutorThreadCount(),
                new DefaultThreadFactory("redis-cmd"));
    }

    @Override
    public void start() {
        final ServerBootstrap serverBootstrap = new ServerBootstrap();
        serverBootstrap.group(bossGroup, workerGroup)
                .channel(serverChannelClass)
                .option(ChannelOption.SO_BACKLOG, config.getBacklogSize())
                .childOption(ChannelOption.SO_KEEPALIVE, true)
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childOption(ChannelOption.SO_RCVBUF, config.getReceiveBufferSize())
                .childOption(ChannelOption.SO_SNDBUF, config.getSendBufferSize())
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(final SocketChannel ch) {
                        final ChannelPipeline pipeline = ch.pipeline();
                        pipeline.addLast(new RespDecoder());
                        pipeline.addLast(new RespEncoder());
                        pipeline.addLast(commandExecutorGroup, new RespCommandHandler(commandExecutor));
                    }
                });

        final ChannelFuture bindFuture = serverBootstrap.bind(config.getHost(), config.getPort())
                .awaitUninterruptibly();
        if (!bindFuture.isSuccess()) {
            stop();
            throw new ServerStartException(
                    "无法绑定 " + config.getHost() + ":" + config.getPort(), bindFuture.cause());
        }
        serverChannel = bindFuture.channel();
        log.info("Redis server started at {}:{}", config.getHost(), getPort());
    }

    @Override
    public void stop() {
        try {
            if (serverChannel != null) {
                serverChannel.close().sync();
            }
            if (workerGroup != null) {
                workerGroup.shutdownGracefully().sync();
            }
            if (bossGroup != null) {
                bossGroup.shutdownGracefully().sync();
            }
            if (commandExecutorGroup != null) {
                commandExecutorGroup.shutdownGracefully().sync();
            }
            log.info("Redis server stopped");
        } catch (InterruptedException e) {
            log.error("Redis server stop error", e);
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void awaitClose() throws InterruptedException {
        final Channel channel = serverChannel;
        if (channel != null) {
            channel.closeFuture().sync();
        }
    }

    @Override
    public int getPort() {
        final Channel channel = serverChannel;
        if (channel == null) {
            return -1;
        }
        return ((InetSocketAddress) channel.localAddress()).getPort();
    }

    @Override
    public RedisCore getRedisCore() {
        return redisCore;
    }

    private void initializeEventLoopGroups() {
        final String osName = System.getProperty("os.name").toLowerCase();

        if (Epoll.isAvailable()) {
            log.info("使用Epoll EventLoopGroup (操作系统: {})", osName);
            this.bossGroup = new EpollEventLoopGroup(config.getBossThreadCount(),
                    new DefaultThreadFactory("epoll-boss"));
            this.workerGroup = new EpollEventLoopGroup(config.getWorkerThreadCount(),
                    new DefaultThreadFactory("epoll-worker"));
            this.serverChannelClass = EpollServerSocketChannel.class;
        } else if (KQueue.isAvailable()) {
            log.info("使用KQueue EventLoopGroup (操作系统: {})", osName);
            this.bossGroup = new KQueueEventLoopGroup(config.getBossThreadCount(),
                    new DefaultThreadFactory("kqueue-boss"));
            this.workerGroup = new KQueueEventLoopGroup(config.getWorkerThreadCount(),
                    new DefaultThreadFactory("kqueue-worker"));
            this.serverChannelClass = KQueueServerSocketChannel.class;
        } else {
            log.info("使用NIO EventLoopGroup (操作系统: {})", osName);
            this.bossGroup = new NioEventLoopGroup(config.getBossThreadCount(),
                    new DefaultThreadFactory("nio-boss"));
            this.workerGroup = new NioEventLoopGroup(config.getWorkerThreadCount(),
                    new DefaultThreadFactory("nio-worker"));
            this.serverChannelClass = NioServerSocketChannel.class;
        }
    }
}
