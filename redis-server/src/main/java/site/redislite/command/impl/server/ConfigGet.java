package site.redislite.command.impl.server;

import lombok.Getter;
import site.redislite.command.Command;
import site.redislite.command.CommandArgs;
import site.redislite.command.CommandType;
import site.redislite.command.CommandValidationException;
import site.redislite.core.RedisCore;
import site.redislite.datastructure.RedisBytes;
import site.redislite.protocol.BulkString;
import site.redislite.protocol.Resp;
import site.redislite.protocol.RespArray;

import java.util.Locale;

/**
 * CONFIG GET parameter
 *
 * <p>子命令必须是小写的 {@code get}，参数名大小写不敏感。
 * 支持 {@code dir} 和 {@code dbfilename}。找到时回复
 * {@code [参数名, 值]} 两元素数组，参数名使用小写规范形式；
 * 未知参数或未设置的目录回复null批量字符串。
 *
 * @author hnfy258
 */
public class ConfigGet implements Command {

    private static final byte[] GET = {'g', 'e', 't'};

    private final RedisCore redisCore;
    @Getter
    private String parameter;

    public ConfigGet(final RedisCore redisCore) {
        this.redisCore = redisCore;
    }

    @Override
    public CommandType getType() {
        return CommandType.CONFIG;
    }

    @Override
    public void setContext(final Resp[] array) {
        CommandArgs.requireArity(array, 3, "config");
        final RedisBytes subcommand = CommandArgs.bulkArg(array, 1, "config");
        if (!subcommand.equalsByteArray(GET)) {
            throw new CommandValidationException(
                    "ERR unknown subcommand '" + subcommand.getString() + "' for 'config' command");
        }
        parameter = CommandArgs.bulkArg(array, 2, "config").getString().toLowerCase(Locale.ROOT);
    }

    /**
     * @throws site.redislite.core.ConfigNotSuppliedException 启动时没有提供配置
     */
    @Override
    public Resp handle() {
        final String value = redisCore.configGet(parameter);
        if (value == null) {
            return BulkString.NULL;
        }
        return RespArray.valueOf(BulkString.fromString(parameter), BulkString.fromString(value));
    }
}
