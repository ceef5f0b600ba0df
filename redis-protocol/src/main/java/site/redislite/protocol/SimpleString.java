package site.redislite.protocol;

import io.netty.buffer.ByteBuf;
import lombok.Getter;

import java.nio.charset.StandardCharsets;

/**
 * Redis简单字符串类型
 *
 * <p>单行、非二进制安全的字符串，编码为 {@code +内容\r\n}。
 * 常用响应预分配为常量并缓存编码结果。
 *
 * @author hnfy258
 * @since 1.0.0
 */
@Getter
public class SimpleString extends Resp {
    /** 预定义的成功响应 */
    public static final SimpleString OK = new SimpleString("OK");

    /** 预定义的心跳响应 */
    public static final SimpleString PONG = new SimpleString("PONG");

    /** 字符串内容 */
    private final String content;

    /** 字符串的字节表示 */
    private final byte[] contentBytes;

    public SimpleString(final String content) {
        this.content = content;
        this.contentBytes = content.getBytes(StandardCharsets.UTF_8);
    }

    @Override
    public void encode(final ByteBuf byteBuf) {
        byteBuf.writeByte('+');
        byteBuf.writeBytes(contentBytes);
        byteBuf.writeBytes(CRLF);
    }

    @Override
    public String toString() {
        return content;
    }
}
