package site.redislite.server;

import site.redislite.core.RedisCore;

/**
 * Redis服务器接口
 *
 * @author hnfy258
 * @since 1.0
 */
public interface RedisServer {

    /**
     * 绑定端口并开始接受连接。
     *
     * @throws ServerStartException 绑定失败
     */
    void start();

    /**
     * 关闭监听端口和所有线程池。
     */
    void stop();

    /**
     * 阻塞直到监听端口关闭。
     *
     * @throws InterruptedException 等待时被中断
     */
    void awaitClose() throws InterruptedException;

    /**
     * 实际监听的端口，配置端口为0时由系统分配。
     *
     * @return 端口号，未启动时返回-1
     */
    int getPort();

    RedisCore getRedisCore();
}
