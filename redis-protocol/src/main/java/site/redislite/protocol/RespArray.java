package site.redislite.protocol;

import io.netty.buffer.ByteBuf;
import lombok.Getter;

import java.nio.charset.StandardCharsets;

/**
 * Redis数组类型
 *
 * <p>有序的RESP值序列，可以为空，元素可以是任意类型，包括嵌套数组。
 *
 * @author hnfy258
 * @since 1.0.0
 */
@Getter
public class RespArray extends Resp {
    /** 空数组的RESP编码 */
    private static final byte[] EMPTY_ARRAY_BYTES = "*0\r\n".getBytes(StandardCharsets.US_ASCII);

    /** 预定义的空数组实例 */
    public static final RespArray EMPTY = new RespArray(new Resp[0]);

    /** 数组内容 */
    private final Resp[] content;

    public RespArray(final Resp[] content) {
        if (content == null) {
            throw new IllegalArgumentException("数组内容不能为null");
        }
        this.content = content;
    }

    /**
     * 工厂方法：空数组返回缓存实例。
     *
     * @param content 数组内容
     * @return RespArray 实例
     */
    public static RespArray valueOf(final Resp... content) {
        if (content.length == 0) {
            return EMPTY;
        }
        return new RespArray(content);
    }

    public int size() {
        return content.length;
    }

    @Override
    public void encode(final ByteBuf byteBuf) {
        if (content.length == 0) {
            byteBuf.writeBytes(EMPTY_ARRAY_BYTES);
            return;
        }

        byteBuf.writeByte('*');
        byteBuf.writeBytes(Integer.toString(content.length).getBytes(StandardCharsets.US_ASCII));
        byteBuf.writeBytes(CRLF);

        for (final Resp element : content) {
            element.encode(byteBuf);
        }
    }
}
