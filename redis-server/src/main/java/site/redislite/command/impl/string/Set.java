package site.redislite.command.impl.string;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import site.redislite.command.Command;
import site.redislite.command.CommandArgs;
import site.redislite.command.CommandType;
import site.redislite.command.CommandValidationException;
import site.redislite.core.RedisCore;
import site.redislite.datastructure.RedisBytes;
import site.redislite.protocol.Resp;
import site.redislite.protocol.SimpleString;

/**
 * SET key value [PX milliseconds]
 *
 * <p>带PX选项时写入带过期时间的条目，否则写入永久条目并清除旧的过期时间。
 * 选项名 {@code px} 区分大小写。
 *
 * @author hnfy258
 */
@Slf4j
@Getter
public class Set implements Command {

    /** 没有过期时间 */
    public static final long NO_TTL = -1;

    private static final byte[] PX = {'p', 'x'};

    private final RedisCore redisCore;
    private RedisBytes key;
    private RedisBytes value;
    private long ttlMillis = NO_TTL;

    public Set(final RedisCore redisCore) {
        this.redisCore = redisCore;
    }

    @Override
    public CommandType getType() {
        return CommandType.SET;
    }

    @Override
    public void setContext(final Resp[] array) {
        if (array.length != 3 && array.length != 5) {
            throw CommandArgs.wrongArity("set");
        }
        key = CommandArgs.bulkArg(array, 1, "set");
        value = CommandArgs.bulkArg(array, 2, "set");
        if (array.length == 5) {
            final RedisBytes option = CommandArgs.bulkArg(array, 3, "set");
            if (!option.equalsByteArray(PX)) {
                throw new CommandValidationException("ERR syntax error");
            }
            ttlMillis = parseTtl(CommandArgs.bulkArg(array, 4, "set"));
        }
    }

    /**
     * 解析无符号十进制毫秒数，超过long范围时截断为Long.MAX_VALUE。
     */
    private static long parseTtl(final RedisBytes text) {
        final byte[] bytes = text.getBytesUnsafe();
        if (bytes.length == 0) {
            throw new CommandValidationException("ERR value is not an integer or out of range");
        }
        for (final byte b : bytes) {
            if (b < '0' || b > '9') {
                throw new CommandValidationException("ERR value is not an integer or out of range");
            }
        }
        final long parsed;
        try {
            parsed = Long.parseUnsignedLong(text.getString());
        } catch (NumberFormatException e) {
            throw new CommandValidationException("ERR value is not an integer or out of range");
        }
        return parsed < 0 ? Long.MAX_VALUE : parsed;
    }

    public boolean hasExpiry() {
        return ttlMillis != NO_TTL;
    }

    @Override
    public Resp handle() {
        if (hasExpiry()) {
            redisCore.setWithExpiry(key, value, ttlMillis);
            log.debug("SET {} PX {}", key, ttlMillis);
        } else {
            redisCore.set(key, value);
        }
        return SimpleString.OK;
    }
}
