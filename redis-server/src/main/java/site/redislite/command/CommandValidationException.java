package site.redislite.command;

/**
 * 命令参数校验失败，消息会原样作为错误回复发送给客户端。
 *
 * @author hnfy258
 */
public class CommandValidationException extends IllegalArgumentException {

    public CommandValidationException(final String message) {
        super(message);
    }
}
