package site.redislite.protocol;

import io.netty.buffer.ByteBuf;
import lombok.Getter;

import java.nio.charset.StandardCharsets;

/**
 * Redis错误消息类型
 *
 * <p>向客户端传递错误信息，编码为 {@code -错误消息\r\n}，例如
 * {@code -ERR unknown command 'foobar'}。
 *
 * <p>错误消息只能占一行，消息中的\r和\n在构造时替换为空格，
 * 客户端发送的任意字节拼进消息后也不会破坏回复流。
 *
 * @author hnfy258
 * @since 1.0.0
 */
@Getter
public class Errors extends Resp {
    /** 错误消息内容 */
    private final String content;

    public Errors(final String content) {
        this.content = content.replace('\r', ' ').replace('\n', ' ');
    }

    @Override
    public void encode(final ByteBuf byteBuf) {
        byteBuf.writeByte('-');
        byteBuf.writeBytes(content.getBytes(StandardCharsets.UTF_8));
        byteBuf.writeBytes(CRLF);
    }

    @Override
    public String toString() {
        return content;
    }
}
