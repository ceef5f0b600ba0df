package site.redislite.protocol;

import io.netty.buffer.ByteBuf;
import lombok.Getter;
import site.redislite.datastructure.RedisBytes;

import java.nio.charset.StandardCharsets;

/**
 * Redis批量字符串类型
 *
 * <p>二进制安全、带长度前缀的字符串。内容为null时表示null批量字符串，
 * 编码为 {@code $-1\r\n}，与空字符串 {@code $0\r\n\r\n} 区分开。
 *
 * <p>使用建议：
 * <ul>
 *     <li>解码器等内部路径使用 {@link #wrapTrusted(byte[])}</li>
 *     <li>外部数据使用 {@link #create(byte[])} 确保安全性</li>
 *     <li>表示"值不存在"时使用 {@link #NULL}</li>
 * </ul>
 *
 * @author hnfy258
 * @since 1.0.0
 */
@Getter
public class BulkString extends Resp {
    /** 空值的RESP编码 */
    private static final byte[] NULL_BYTES = "$-1\r\n".getBytes(StandardCharsets.US_ASCII);

    /** 空字符串的RESP编码 */
    private static final byte[] EMPTY_BULK = "$0\r\n\r\n".getBytes(StandardCharsets.US_ASCII);

    /** null批量字符串 */
    public static final BulkString NULL = new BulkString((RedisBytes) null);

    /** 字符串内容，null表示null批量字符串 */
    private final RedisBytes content;

    public BulkString(final RedisBytes content) {
        this.content = content;
    }

    /**
     * 零拷贝工厂方法。
     *
     * <p>警告：调用者必须保证bytes数组不会被修改！
     *
     * @param trustedBytes 受信任的字节数组
     * @return 零拷贝的BulkString实例
     */
    public static BulkString wrapTrusted(final byte[] trustedBytes) {
        if (trustedBytes == null) {
            return NULL;
        }
        return new BulkString(RedisBytes.wrapTrusted(trustedBytes));
    }

    public static BulkString fromString(final String str) {
        if (str == null) {
            return NULL;
        }
        return new BulkString(RedisBytes.fromString(str));
    }

    /**
     * 是否为null批量字符串。
     *
     * @return 内容为null返回true
     */
    public boolean isNull() {
        return content == null;
    }

    @Override
    public void encode(final ByteBuf byteBuf) {
        if (content == null) {
            byteBuf.writeBytes(NULL_BYTES);
            return;
        }

        final byte[] bytes = content.getBytesUnsafe();
        if (bytes.length == 0) {
            byteBuf.writeBytes(EMPTY_BULK);
            return;
        }

        // 1. 标识符和长度
        byteBuf.writeByte('$');
        byteBuf.writeBytes(Integer.toString(bytes.length).getBytes(StandardCharsets.US_ASCII));
        byteBuf.writeBytes(CRLF);

        // 2. 内容和结束符
        byteBuf.writeBytes(bytes);
        byteBuf.writeBytes(CRLF);
    }

    /**
     * 获取字符串内容
     *
     * @return 字符串内容，null批量字符串返回 null
     */
    @Override
    public String toString() {
        return content != null ? content.getString() : null;
    }
}
