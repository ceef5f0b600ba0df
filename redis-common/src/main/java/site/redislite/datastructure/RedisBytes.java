package site.redislite.datastructure;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * 不可变的二进制安全字节串，用作键、值以及命令名。
 *
 * <p>设计要点：
 * <ul>
 *   <li>构造时执行防御性拷贝，{@link #wrapTrusted(byte[])} 提供受信任场景下的零拷贝路径
 *   <li>哈希值在构造时预计算，适合作为 HashMap 的键
 *   <li>字符串表示延迟计算并缓存，仅用于日志和命令名匹配
 * </ul>
 *
 * <p>线程安全性：本类不可变，可在连接之间自由共享。
 *
 * @author hnfy258
 * @since 1.0
 */
public final class RedisBytes {

    /**
     * 字符串编码解码使用的字符集。
     */
    public static final Charset CHARSET = StandardCharsets.UTF_8;

    /**
     * 预分配的空字节串实例。
     */
    public static final RedisBytes EMPTY = new RedisBytes(new byte[0], true);

    /**
     * toString 预览的最大字节数。
     */
    private static final int PREVIEW_LENGTH = 16;

    private final byte[] bytes;

    private final int hashCode;

    /**
     * 延迟初始化的字符串值。
     */
    private volatile String stringValue;

    /**
     * 创建字节串实例，执行防御性拷贝。
     *
     * @param bytes 源字节数组，不能为null
     * @throws IllegalArgumentException 如果bytes为null
     */
    public RedisBytes(final byte[] bytes) {
        this(bytes, false);
    }

    private RedisBytes(final byte[] bytes, final boolean trusted) {
        if (bytes == null) {
            throw new IllegalArgumentException("字节数组不能为null");
        }
        this.bytes = trusted ? bytes : bytes.clone();
        this.hashCode = Arrays.hashCode(this.bytes);
    }

    /**
     * 创建零拷贝实例。
     *
     * <p><b>警告</b>：调用者必须保证参数数组之后不再被修改，仅用于解码器等内部受信任场景。
     *
     * @param trustedBytes 受信任的字节数组
     * @return RedisBytes实例，如果输入为null则返回null
     */
    public static RedisBytes wrapTrusted(final byte[] trustedBytes) {
        if (trustedBytes == null) {
            return null;
        }
        if (trustedBytes.length == 0) {
            return EMPTY;
        }
        return new RedisBytes(trustedBytes, true);
    }

    /**
     * 按UTF-8编码从字符串创建实例。
     *
     * @param str 源字符串
     * @return RedisBytes实例，如果输入为null则返回null
     */
    public static RedisBytes fromString(final String str) {
        if (str == null) {
            return null;
        }
        if (str.isEmpty()) {
            return EMPTY;
        }
        final RedisBytes redisBytes = new RedisBytes(str.getBytes(CHARSET), true);
        redisBytes.stringValue = str;
        return redisBytes;
    }

    /**
     * 获取底层字节数组的副本。
     *
     * @return 字节数组副本
     */
    public byte[] getBytes() {
        return bytes.clone();
    }

    /**
     * 获取底层字节数组的直接引用，用于编码等只读场景。
     *
     * <p><strong>警告：</strong>调用者不得修改返回的数组！
     *
     * @return 字节数组的直接引用
     */
    public byte[] getBytesUnsafe() {
        return bytes;
    }

    /**
     * 获取UTF-8解码后的字符串表示。
     *
     * @return 字符串值
     */
    public String getString() {
        String result = stringValue;
        if (result == null) {
            result = new String(bytes, CHARSET);
            stringValue = result;
        }
        return result;
    }

    /**
     * 将ASCII大写字母折叠为小写，其余字节保持不变。
     *
     * @return 折叠后的新实例；不含大写字母时返回自身
     */
    public RedisBytes toLowerCase() {
        byte[] folded = null;
        for (int i = 0; i < bytes.length; i++) {
            final byte b = bytes[i];
            if (b >= 'A' && b <= 'Z') {
                if (folded == null) {
                    folded = bytes.clone();
                }
                folded[i] = (byte) (b + ('a' - 'A'));
            }
        }
        return folded == null ? this : new RedisBytes(folded, true);
    }

    /**
     * 直接与字节数组比较，避免创建临时对象。
     *
     * @param otherBytes 要比较的字节数组
     * @return 内容相等返回true
     */
    public boolean equalsByteArray(final byte[] otherBytes) {
        return Arrays.equals(this.bytes, otherBytes);
    }

    public int length() {
        return bytes.length;
    }

    public boolean isEmpty() {
        return bytes.length == 0;
    }

    @Override
    public boolean equals(final Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        final RedisBytes other = (RedisBytes) obj;
        return hashCode == other.hashCode && Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        final StringBuilder sb = new StringBuilder();
        sb.append("RedisBytes[length=").append(bytes.length).append(", preview='");
        for (int i = 0; i < Math.min(bytes.length, PREVIEW_LENGTH); i++) {
            final byte b = bytes[i];
            if (b >= 32 && b <= 126) {
                sb.append((char) b);
            } else {
                sb.append("\\x").append(String.format("%02x", b & 0xFF));
            }
        }
        if (bytes.length > PREVIEW_LENGTH) {
            sb.append("...");
        }
        return sb.append("']").toString();
    }
}
