package site.redislite.command;

import lombok.Getter;
import site.redislite.command.impl.Ping;
import site.redislite.command.impl.server.ConfigGet;
import site.redislite.command.impl.string.Echo;
import site.redislite.command.impl.string.Get;
import site.redislite.command.impl.string.Set;
import site.redislite.core.RedisCore;
import site.redislite.datastructure.RedisBytes;

import java.util.HashMap;
import java.util.Map;

/**
 * Redis命令类型枚举，定义了系统支持的所有命令。
 *
 * <p>命令名按小写存储，查找前调用方需要先做ASCII大小写折叠，
 * 见 {@link #findByBytes(RedisBytes)}。
 *
 * @author hnfy258
 * @since 1.0
 */
@Getter
public enum CommandType {
    /** PING命令：测试服务器连接 */
    PING("ping"),
    /** ECHO命令：原样返回参数 */
    ECHO("echo"),
    /** GET命令：获取键值 */
    GET("get"),
    /** SET命令：设置键值对，可选PX过期时间 */
    SET("set"),
    /** CONFIG命令：目前只支持CONFIG GET */
    CONFIG("config");

    /** 小写命令名 */
    private final RedisBytes commandBytes;

    /** 命令查找缓存 */
    private static final Map<RedisBytes, CommandType> COMMAND_CACHE = new HashMap<>();

    static {
        for (final CommandType type : CommandType.values()) {
            COMMAND_CACHE.put(type.commandBytes, type);
        }
    }

    CommandType(final String commandName) {
        this.commandBytes = RedisBytes.fromString(commandName);
    }

    /**
     * 根据命令名查找命令类型，大小写不敏感。
     *
     * @param commandBytes 命令名字节
     * @return 对应的CommandType，如果不存在则返回null
     */
    public static CommandType findByBytes(final RedisBytes commandBytes) {
        if (commandBytes == null) {
            return null;
        }
        return COMMAND_CACHE.get(commandBytes.toLowerCase());
    }

    /**
     * 创建绑定到存储的命令实例。
     *
     * @param redisCore 共享存储
     * @return 尚未设置参数的命令实例
     */
    public Command createCommand(final RedisCore redisCore) {
        switch (this) {
            case PING:
                return new Ping();
            case ECHO:
                return new Echo();
            case GET:
                return new Get(redisCore);
            case SET:
                return new Set(redisCore);
            case CONFIG:
                return new ConfigGet(redisCore);
            default:
                throw new IllegalArgumentException("不支持的命令类型: " + this);
        }
    }
}
