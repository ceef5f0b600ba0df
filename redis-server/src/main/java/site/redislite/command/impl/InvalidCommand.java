package site.redislite.command.impl;

import lombok.Getter;
import site.redislite.command.Command;
import site.redislite.command.CommandType;
import site.redislite.protocol.Errors;
import site.redislite.protocol.Resp;

/**
 * 校验失败的命令，执行时返回携带原因的错误回复。
 *
 * @author hnfy258
 */
@Getter
public class InvalidCommand implements Command {

    private final String reason;

    public InvalidCommand(final String reason) {
        this.reason = reason;
    }

    /**
     * 无效命令没有对应的命令类型。
     *
     * @return null
     */
    @Override
    public CommandType getType() {
        return null;
    }

    @Override
    public void setContext(final Resp[] array) {
        // 构造时已确定原因
    }

    @Override
    public Resp handle() {
        return new Errors(reason);
    }
}
