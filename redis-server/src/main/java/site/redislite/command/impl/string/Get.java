package site.redislite.command.impl.string;

import lombok.Getter;
import site.redislite.command.Command;
import site.redislite.command.CommandArgs;
import site.redislite.command.CommandType;
import site.redislite.core.RedisCore;
import site.redislite.datastructure.RedisBytes;
import site.redislite.protocol.BulkString;
import site.redislite.protocol.Resp;

public class Get implements Command {
    private final RedisCore redisCore;
    @Getter
    private RedisBytes key;

    public Get(final RedisCore redisCore) {
        this.redisCore = redisCore;
    }

    @Override
    public CommandType getType() {
        return CommandType.GET;
    }

    @Override
    public void setContext(final Resp[] array) {
        CommandArgs.requireArity(array, 2, "get");
        key = CommandArgs.bulkArg(array, 1, "get");
    }

    @Override
    public Resp handle() {
        final RedisBytes value = redisCore.get(key);
        return value == null ? BulkString.NULL : new BulkString(value);
    }
}
