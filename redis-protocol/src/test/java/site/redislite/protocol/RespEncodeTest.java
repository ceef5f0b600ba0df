package site.redislite.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RESP 编码测试")
class RespEncodeTest {

    private static String encode(final Resp resp) {
        final ByteBuf buf = Unpooled.buffer();
        try {
            resp.encode(buf);
            return buf.toString(StandardCharsets.UTF_8);
        } finally {
            buf.release();
        }
    }

    @Test
    void testSimpleString() {
        assertEquals("+PONG\r\n", encode(SimpleString.PONG));
        assertEquals("+OK\r\n", encode(SimpleString.OK));
    }

    @Test
    void testError() {
        assertEquals("-ERR unknown command 'foo'\r\n", encode(new Errors("ERR unknown command 'foo'")));
    }

    @Test
    @DisplayName("错误消息中的换行符替换为空格")
    void testErrorStaysOnOneLine() {
        final Errors error = new Errors("ERR unknown command 'a\r\n:1\r\nb\n'");

        assertEquals("ERR unknown command 'a  :1  b '", error.getContent());
        assertEquals("-ERR unknown command 'a  :1  b '\r\n", encode(error));
    }

    @Test
    void testInteger() {
        assertEquals(":0\r\n", encode(RespInteger.valueOf(0)));
        assertEquals(":18446744073709551615\r\n", encode(RespInteger.valueOf(-1L)));
    }

    @Test
    void testBulkString() {
        assertEquals("$3\r\nhey\r\n", encode(BulkString.fromString("hey")));
        assertEquals("$0\r\n\r\n", encode(BulkString.fromString("")));
        assertEquals("$-1\r\n", encode(BulkString.NULL));
        assertEquals("$-1\r\n", encode(BulkString.wrapTrusted(null)));
    }

    @Test
    @DisplayName("配置项数组")
    void testArray() {
        final RespArray array = RespArray.valueOf(BulkString.fromString("dir"), BulkString.fromString("/tmp"));
        assertEquals("*2\r\n$3\r\ndir\r\n$4\r\n/tmp\r\n", encode(array));
        assertEquals("*0\r\n", encode(RespArray.valueOf()));
    }

    @ParameterizedTest
    @ValueSource(ints = {0, 1, 2, 13, 255, 4096})
    @DisplayName("批量字符串编码后解码得到原始字节")
    void testBulkStringRoundTrip(final int length) {
        final byte[] payload = new byte[length];
        for (int i = 0; i < length; i++) {
            payload[i] = (byte) (i * 31);
        }

        final ByteBuf buf = Unpooled.buffer();
        try {
            BulkString.wrapTrusted(payload).encode(buf);
            final BulkString decoded = (BulkString) Resp.decode(buf);

            assertArrayEquals(payload, decoded.getContent().getBytes());
            assertEquals(0, buf.readableBytes());
        } finally {
            buf.release();
        }
    }
}
