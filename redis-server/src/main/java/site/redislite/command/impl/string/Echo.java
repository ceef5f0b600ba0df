package site.redislite.command.impl.string;

import lombok.Getter;
import site.redislite.command.Command;
import site.redislite.command.CommandArgs;
import site.redislite.command.CommandType;
import site.redislite.datastructure.RedisBytes;
import site.redislite.protocol.BulkString;
import site.redislite.protocol.Resp;

@Getter
public class Echo implements Command {
    private RedisBytes payload;

    @Override
    public CommandType getType() {
        return CommandType.ECHO;
    }

    @Override
    public void setContext(final Resp[] array) {
        CommandArgs.requireArity(array, 2, "echo");
        payload = CommandArgs.bulkArg(array, 1, "echo");
    }

    @Override
    public Resp handle() {
        return new BulkString(payload);
    }
}
