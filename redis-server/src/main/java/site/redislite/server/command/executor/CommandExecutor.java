package site.redislite.server.command.executor;

import lombok.extern.slf4j.Slf4j;
import site.redislite.command.Command;
import site.redislite.command.CommandParser;
import site.redislite.core.ConfigNotSuppliedException;
import site.redislite.core.RedisCore;
import site.redislite.protocol.Errors;
import site.redislite.protocol.Resp;

/**
 * Redis命令执行器，负责把一条解码后的请求变成一条回复。
 *
 * <p>执行流程：
 * <ul>
 *   <li>由 {@link CommandParser} 解析并校验，校验失败得到错误回复
 *   <li>对共享存储执行命令
 *   <li>缺少启动配置时回复错误，连接不受影响
 *   <li>其他运行时异常记录日志并回复通用错误
 * </ul>
 *
 * <p>执行器本身无状态，可以被所有连接共享。
 *
 * @author hnfy258
 * @since 1.0
 */
@Slf4j
public class CommandExecutor {

    private static final Errors COMMAND_EXECUTION_ERROR = new Errors("ERR command execution failed");

    private final CommandParser commandParser;

    public CommandExecutor(final RedisCore redisCore) {
        this(new CommandParser(redisCore));
    }

    public CommandExecutor(final CommandParser commandParser) {
        this.commandParser = commandParser;
    }

    /**
     * 执行一条请求。
     *
     * @param request 解码器产出的请求
     * @return 回复，不会为null
     */
    public Resp execute(final Resp request) {
        final Command command = commandParser.parse(request);
        try {
            return command.handle();
        } catch (ConfigNotSuppliedException e) {
            return new Errors("ERR " + e.getMessage());
        } catch (RuntimeException e) {
            log.error("命令执行失败: {}", command.getType(), e);
            return COMMAND_EXECUTION_ERROR;
        }
    }
}
