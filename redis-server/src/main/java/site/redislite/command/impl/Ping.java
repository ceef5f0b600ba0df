package site.redislite.command.impl;

import site.redislite.command.Command;
import site.redislite.command.CommandArgs;
import site.redislite.command.CommandType;
import site.redislite.protocol.Resp;
import site.redislite.protocol.SimpleString;

public class Ping implements Command {
    @Override
    public CommandType getType() {
        return CommandType.PING;
    }

    @Override
    public void setContext(final Resp[] array) {
        CommandArgs.requireArity(array, 1, "ping");
    }

    @Override
    public Resp handle() {
        return SimpleString.PONG;
    }
}
