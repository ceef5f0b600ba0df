package site.redislite.protocol;

import io.netty.buffer.ByteBuf;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;

/**
 * Redis协议基础类
 *
 * <p>RESP协议所有数据类型的基类，定义统一的编码接口，并提供递归下降的增量解码实现。
 *
 * <p>支持的数据类型：
 * <ul>
 *     <li>简单字符串 - 以"+"开头</li>
 *     <li>错误消息 - 以"-"开头</li>
 *     <li>整数 - 以":"开头，无符号64位</li>
 *     <li>批量字符串 - 以"$"开头</li>
 *     <li>数组 - 以"*"开头，元素可以是任意类型，包括嵌套数组</li>
 * </ul>
 *
 * <p>解码约定：
 * <ul>
 *     <li>数据不完整时返回null并回滚读索引，等待更多数据</li>
 *     <li>格式错误时抛出 {@link RespProtocolException}，调用方应关闭连接而不是尝试重新同步</li>
 *     <li>长度、元素数量、嵌套深度和行长度都有上限，防止恶意客户端耗尽内存或栈</li>
 * </ul>
 *
 * @author hnfy258
 * @since 1.0.0
 */
@Slf4j
public abstract class Resp {
    /** 行结束符 */
    public static final byte[] CRLF = "\r\n".getBytes(StandardCharsets.US_ASCII);

    /** 批量字符串最大长度 512MB */
    public static final long PROTO_MAX_BULK_LEN = 512L * 1024 * 1024;

    /** 数组最大元素数量 */
    public static final long PROTO_MAX_ARRAY_LEN = 1024 * 1024;

    /** 数组最大嵌套深度 */
    public static final int PROTO_MAX_NESTING_DEPTH = 64;

    /** 类型行（不含\r\n）的最大长度 */
    public static final int PROTO_MAX_LINE_LEN = 64 * 1024;

    /**
     * 将当前值编码为RESP格式写入缓冲区。
     *
     * @param byteBuf 输出缓冲区
     */
    public abstract void encode(ByteBuf byteBuf);

    /**
     * RESP 协议解码方法
     *
     * <p>从缓冲区当前读位置解码一个完整的值，成功时读索引停在该值之后。
     *
     * @param buffer 输入缓冲区
     * @return 解码后的 Resp 对象，如果数据不完整返回null
     * @throws RespProtocolException 当数据格式不符合RESP协议规范时
     */
    public static Resp decode(final ByteBuf buffer) {
        final int initialIndex = buffer.readerIndex();
        try {
            final Resp resp = decode(buffer, 0);
            if (resp == null) {
                buffer.readerIndex(initialIndex);
            }
            return resp;
        } catch (RespProtocolException e) {
            buffer.readerIndex(initialIndex);
            throw e;
        }
    }

    private static Resp decode(final ByteBuf buffer, final int depth) {
        final int lineStart = buffer.readerIndex();
        final int lineEnd = findLineEnd(buffer);
        if (lineEnd < 0) {
            return null;
        }
        if (lineEnd == lineStart) {
            throw new RespProtocolException("协议错误：空行，缺少类型标识");
        }

        final byte typeIndicator = buffer.getByte(lineStart);
        final int contentStart = lineStart + 1;
        // 跳过整行及\r\n
        buffer.readerIndex(lineEnd + 2);

        switch (typeIndicator) {
            case '+':
                return new SimpleString(readText(buffer, contentStart, lineEnd));
            case '-':
                return new Errors(readText(buffer, contentStart, lineEnd));
            case ':':
                return RespInteger.valueOf(parseUnsigned(buffer, contentStart, lineEnd));
            case '$':
                return decodeBulkString(buffer, parseUnsigned(buffer, contentStart, lineEnd));
            case '*':
                return decodeArray(buffer, parseUnsigned(buffer, contentStart, lineEnd), depth);
            default:
                log.debug("无法识别的RESP类型标识 (字节值: {})", typeIndicator & 0xFF);
                throw new RespProtocolException("协议错误：无效的RESP类型标识 '" + (char) typeIndicator + "'");
        }
    }

    private static Resp decodeBulkString(final ByteBuf buffer, final long length) {
        if (Long.compareUnsigned(length, PROTO_MAX_BULK_LEN) > 0) {
            throw new RespProtocolException("协议错误：批量字符串的长度超过最大限制 " + PROTO_MAX_BULK_LEN);
        }
        final int size = (int) length;
        if (buffer.readableBytes() < size + 2) {
            return null;
        }

        final byte[] content = new byte[size];
        buffer.readBytes(content);
        if (buffer.readByte() != '\r' || buffer.readByte() != '\n') {
            throw new RespProtocolException("协议错误：批量字符串缺少\\r\\n结尾");
        }
        // content 由解码器独占，可以零拷贝包装
        return BulkString.wrapTrusted(content);
    }

    private static Resp decodeArray(final ByteBuf buffer, final long count, final int depth) {
        if (Long.compareUnsigned(count, PROTO_MAX_ARRAY_LEN) > 0) {
            throw new RespProtocolException("协议错误：数组的元素数量超过最大限制 " + PROTO_MAX_ARRAY_LEN);
        }
        if (depth >= PROTO_MAX_NESTING_DEPTH) {
            throw new RespProtocolException("协议错误：数组嵌套深度超过最大限制 " + PROTO_MAX_NESTING_DEPTH);
        }
        if (count == 0) {
            return RespArray.EMPTY;
        }

        final Resp[] array = new Resp[(int) count];
        for (int i = 0; i < array.length; i++) {
            final Resp element = decode(buffer, depth + 1);
            if (element == null) {
                return null;
            }
            array[i] = element;
        }
        return new RespArray(array);
    }

    /**
     * 查找当前行的\r位置。
     *
     * @return \r的绝对索引；数据不完整返回-1
     * @throws RespProtocolException \r后不是\n，或行过长
     */
    private static int findLineEnd(final ByteBuf buffer) {
        final int startIndex = buffer.readerIndex();
        final int searchEnd = Math.min(buffer.writerIndex(), startIndex + PROTO_MAX_LINE_LEN + 1);
        final int endIndex = buffer.indexOf(startIndex, searchEnd, (byte) '\r');

        if (endIndex < 0) {
            if (searchEnd - startIndex > PROTO_MAX_LINE_LEN) {
                throw new RespProtocolException("协议错误：行长度超过最大限制 " + PROTO_MAX_LINE_LEN);
            }
            return -1;
        }
        if (endIndex + 1 >= buffer.writerIndex()) {
            return -1;
        }
        if (buffer.getByte(endIndex + 1) != '\n') {
            throw new RespProtocolException("协议错误：期望\\r\\n但找到了其他字符");
        }
        return endIndex;
    }

    private static String readText(final ByteBuf buffer, final int from, final int to) {
        return buffer.toString(from, to - from, StandardCharsets.UTF_8);
    }

    /**
     * 解析无符号64位十进制数。
     *
     * @throws RespProtocolException 为空、包含非数字字符或溢出
     */
    static long parseUnsigned(final ByteBuf buffer, final int from, final int to) {
        if (from == to) {
            throw new RespProtocolException("协议错误：数字为空");
        }
        for (int i = from; i < to; i++) {
            final byte b = buffer.getByte(i);
            if (b < '0' || b > '9') {
                throw new RespProtocolException("协议错误：数字包含非数字字符");
            }
        }
        try {
            return Long.parseUnsignedLong(buffer.toString(from, to - from, StandardCharsets.US_ASCII));
        } catch (NumberFormatException e) {
            throw new RespProtocolException("协议错误：数字超出无符号64位范围");
        }
    }
}
