package site.redislite.command;

import lombok.extern.slf4j.Slf4j;
import site.redislite.command.impl.InvalidCommand;
import site.redislite.core.RedisCore;
import site.redislite.datastructure.RedisBytes;
import site.redislite.protocol.BulkString;
import site.redislite.protocol.Resp;
import site.redislite.protocol.RespArray;

/**
 * 将解码后的RESP值转换为命令。
 *
 * <p>解析不会抛出异常，所有校验失败都转换为 {@link InvalidCommand}，
 * 由执行器作为错误回复返回，连接保持打开。校验顺序：
 * <ol>
 *   <li>顶层必须是非空数组</li>
 *   <li>第0个元素必须是批量字符串，按ASCII大小写折叠后查找命令</li>
 *   <li>各命令自己的参数个数和类型校验</li>
 * </ol>
 *
 * @author hnfy258
 * @since 1.0
 */
@Slf4j
public class CommandParser {

    private final RedisCore redisCore;

    public CommandParser(final RedisCore redisCore) {
        if (redisCore == null) {
            throw new IllegalArgumentException("RedisCore不能为null");
        }
        this.redisCore = redisCore;
    }

    /**
     * 解析一条命令。
     *
     * @param resp 解码器产出的值
     * @return 可执行的命令；校验失败时为 {@link InvalidCommand}
     */
    public Command parse(final Resp resp) {
        if (!(resp instanceof RespArray)) {
            return new InvalidCommand("ERR command must be an array");
        }
        final Resp[] array = ((RespArray) resp).getContent();
        if (array.length == 0) {
            return new InvalidCommand("ERR command must be a non-empty array");
        }
        if (!(array[0] instanceof BulkString) || ((BulkString) array[0]).isNull()) {
            return new InvalidCommand("ERR command name must be a bulk string");
        }

        final RedisBytes name = ((BulkString) array[0]).getContent();
        final CommandType commandType = CommandType.findByBytes(name);
        if (commandType == null) {
            log.debug("未知命令: {}", name);
            return new InvalidCommand("ERR unknown command '" + name.getString() + "'");
        }

        final Command command = commandType.createCommand(redisCore);
        try {
            command.setContext(array);
        } catch (CommandValidationException e) {
            return new InvalidCommand(e.getMessage());
        }
        return command;
    }
}
