package site.redislite.command;

import site.redislite.datastructure.RedisBytes;
import site.redislite.protocol.BulkString;
import site.redislite.protocol.Resp;

/**
 * 命令参数校验的公共方法。
 *
 * @author hnfy258
 */
public final class CommandArgs {

    private CommandArgs() {
    }

    /**
     * 校验命令数组的元素个数（包含命令名）。
     *
     * @throws CommandValidationException 元素个数不等于expected
     */
    public static void requireArity(final Resp[] array, final int expected, final String commandName) {
        if (array.length != expected) {
            throw wrongArity(commandName);
        }
    }

    public static CommandValidationException wrongArity(final String commandName) {
        return new CommandValidationException(
                "ERR wrong number of arguments for '" + commandName + "' command");
    }

    /**
     * 取出第index个参数的内容，参数必须是非null的批量字符串。
     *
     * @throws CommandValidationException 参数不是批量字符串
     */
    public static RedisBytes bulkArg(final Resp[] array, final int index, final String commandName) {
        final Resp arg = array[index];
        if (!(arg instanceof BulkString) || ((BulkString) arg).isNull()) {
            throw new CommandValidationException(
                    "ERR arguments of '" + commandName + "' command must be bulk strings");
        }
        return ((BulkString) arg).getContent();
    }
}
