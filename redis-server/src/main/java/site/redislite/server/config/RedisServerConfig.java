package site.redislite.server.config;

import lombok.Builder;
import lombok.Data;
import site.redislite.core.SnapshotConfig;

/**
 * Redis服务器配置类，统一管理所有服务器配置参数。
 *
 * <p>该类采用Builder模式设计，主要配置包括：
 * <ul>
 *   <li>网络配置：主机地址、端口、连接参数等
 *   <li>线程配置：各类线程池大小设置
 *   <li>快照配置：目录与文件名，仅供CONFIG GET查询
 * </ul>
 *
 * @author hnfy258
 * @since 1.0.0
 */
@Data
@Builder
public class RedisServerConfig {

    // ========== 网络配置 ==========

    /**
     * 服务器监听地址。
     */
    @Builder.Default
    private String host = "127.0.0.1";

    /**
     * 服务器监听端口，0表示由系统分配。
     */
    @Builder.Default
    private int port = 6379;

    /**
     * TCP连接队列大小。
     */
    @Builder.Default
    private int backlogSize = 1024;

    /**
     * 接收缓冲区大小（字节）。
     */
    @Builder.Default
    private int receiveBufferSize = 32 * 1024;

    /**
     * 发送缓冲区大小（字节）。
     */
    @Builder.Default
    private int sendBufferSize = 32 * 1024;

    // ========== 线程配置 ==========

    /**
     * 接受连接的线程数。
     */
    @Builder.Default
    private int bossThreadCount = 1;

    /**
     * 处理网络I/O的线程数。
     */
    @Builder.Default
    private int workerThreadCount = Runtime.getRuntime().availableProcessors() * 2;

    /**
     * 执行命令的线程数。每个连接固定在其中一个线程上。
     */
    @Builder.Default
    private int commandExecutorThreadCount = Runtime.getRuntime().availableProcessors();

    // ========== 快照配置 ==========

    /** 快照目录，null表示未指定 */
    private String dir;

    /** 快照文件名，null表示未指定 */
    private String dbFileName;

    /**
     * 转换为存储使用的快照配置。
     *
     * @return 目录和文件名都未指定时返回null
     */
    public SnapshotConfig toSnapshotConfig() {
        if (dir == null && dbFileName == null) {
            return null;
        }
        return SnapshotConfig.of(dir, dbFileName);
    }

    /**
     * 验证配置参数的合法性
     *
     * @throws IllegalArgumentException 如果配置参数无效
     */
    public void validate() {
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("端口号必须在0-65535范围内");
        }

        if (bossThreadCount <= 0 || workerThreadCount <= 0 || commandExecutorThreadCount <= 0) {
            throw new IllegalArgumentException("线程数量必须大于0");
        }

        if (backlogSize <= 0 || receiveBufferSize <= 0 || sendBufferSize <= 0) {
            throw new IllegalArgumentException("缓冲区大小必须大于0");
        }

        if (dbFileName != null && dbFileName.trim().isEmpty()) {
            throw new IllegalArgumentException("快照文件名不能为空");
        }
    }
}
