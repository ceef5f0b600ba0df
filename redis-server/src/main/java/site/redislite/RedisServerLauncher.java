package site.redislite;

import lombok.extern.slf4j.Slf4j;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import site.redislite.server.RedisMiniServer;
import site.redislite.server.RedisServer;
import site.redislite.server.ServerStartException;
import site.redislite.server.config.RedisServerConfig;

import java.util.concurrent.Callable;

/**
 * 服务器启动入口
 *
 * <p>只接受 {@code --dir} 和 {@code --dbfilename} 两个选项，其他参数都是用法错误，
 * 退出码为2且不会绑定端口。绑定失败时退出码为1。
 *
 * @author hnfy258
 */
@Slf4j
@Command(
        name = "redis-lite",
        description = "In-memory key-value server speaking a subset of RESP.",
        sortOptions = false
)
public class RedisServerLauncher implements Callable<Integer> {

    @Option(names = "--dir", paramLabel = "<path>", description = "Snapshot directory reported by CONFIG GET dir.")
    private String dir;

    @Option(names = "--dbfilename", paramLabel = "<name>",
            description = "Snapshot file name reported by CONFIG GET dbfilename (default: dump.rdb).")
    private String dbFileName;

    @Option(names = "--help", usageHelp = true, description = "Show help.")
    private boolean helpRequested;

    public static void main(final String[] args) {
        final int exitCode = new CommandLine(new RedisServerLauncher()).execute(args);
        if (exitCode != CommandLine.ExitCode.OK) {
            System.exit(exitCode);
        }
    }

    /**
     * 根据命令行选项生成服务器配置。
     */
    RedisServerConfig toServerConfig() {
        return RedisServerConfig.builder()
                .dir(dir)
                .dbFileName(dbFileName)
                .build();
    }

    @Override
    public Integer call() {
        final RedisServer redisServer = new RedisMiniServer(toServerConfig());
        try {
            redisServer.start();
        } catch (ServerStartException e) {
            log.error("服务器启动失败", e);
            return CommandLine.ExitCode.SOFTWARE;
        }

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("正在关闭服务器...");
            redisServer.stop();
        }, "redis-shutdown"));

        try {
            redisServer.awaitClose();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            redisServer.stop();
        }
        return CommandLine.ExitCode.OK;
    }
}
