package site.redislite.protocol;

import io.netty.buffer.ByteBuf;
import lombok.Getter;

import java.nio.charset.StandardCharsets;

/**
 * Redis整数类型
 *
 * <p>值为无符号64位整数，存放在 {@code long} 中，解析和输出始终按无符号处理，
 * 因此超过 {@link Long#MAX_VALUE} 的值在Java侧表现为负数。
 *
 * @author hnfy258
 * @since 1.0.0
 */
@Getter
public class RespInteger extends Resp {
    /** 缓存范围上限 */
    private static final int CACHE_HIGH = 127;

    /** 整数实例缓存数组 */
    private static final RespInteger[] CACHE = new RespInteger[CACHE_HIGH + 1];

    static {
        for (int i = 0; i < CACHE.length; i++) {
            CACHE[i] = new RespInteger(i);
        }
    }

    /** 整数值（无符号） */
    private final long content;

    private RespInteger(final long content) {
        this.content = content;
    }

    /**
     * 工厂方法：0到127之间返回缓存实例。
     *
     * @param value 无符号整数值
     * @return RespInteger 实例
     */
    public static RespInteger valueOf(final long value) {
        if (value >= 0 && value <= CACHE_HIGH) {
            return CACHE[(int) value];
        }
        return new RespInteger(value);
    }

    @Override
    public void encode(final ByteBuf byteBuf) {
        byteBuf.writeByte(':');
        byteBuf.writeBytes(Long.toUnsignedString(content).getBytes(StandardCharsets.US_ASCII));
        byteBuf.writeBytes(CRLF);
    }

    @Override
    public String toString() {
        return Long.toUnsignedString(content);
    }
}
