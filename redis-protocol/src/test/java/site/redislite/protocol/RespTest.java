package site.redislite.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RESP 解码测试")
class RespTest {

    private ByteBuf buffer;

    @AfterEach
    void tearDown() {
        if (buffer != null && buffer.refCnt() > 0) {
            buffer.release();
        }
    }

    private Resp decode(final String input) {
        buffer = Unpooled.copiedBuffer(input, StandardCharsets.UTF_8);
        return Resp.decode(buffer);
    }

    @Nested
    @DisplayName("各类型解码")
    class TypeTests {

        @Test
        void testSimpleString() {
            final Resp resp = decode("+OK\r\n");
            assertInstanceOf(SimpleString.class, resp);
            assertEquals("OK", ((SimpleString) resp).getContent());
            assertEquals(0, buffer.readableBytes());
        }

        @Test
        void testError() {
            final Resp resp = decode("-ERR bad thing\r\n");
            assertInstanceOf(Errors.class, resp);
            assertEquals("ERR bad thing", ((Errors) resp).getContent());
        }

        @Test
        void testInteger() {
            final Resp resp = decode(":1000\r\n");
            assertEquals(1000L, ((RespInteger) resp).getContent());
        }

        @Test
        @DisplayName("整数按无符号64位解析")
        void testUnsignedIntegerAboveLongMax() {
            final Resp resp = decode(":18446744073709551615\r\n");
            assertEquals(-1L, ((RespInteger) resp).getContent());
            assertEquals("18446744073709551615", resp.toString());
        }

        @Test
        void testBulkString() {
            final Resp resp = decode("$5\r\nhello\r\n");
            assertEquals("hello", resp.toString());
        }

        @Test
        @DisplayName("空批量字符串与null批量字符串不同")
        void testEmptyBulkString() {
            final BulkString resp = (BulkString) decode("$0\r\n\r\n");
            assertFalse(resp.isNull());
            assertEquals(0, resp.getContent().length());
        }

        @Test
        @DisplayName("批量字符串二进制安全")
        void testBinarySafeBulkString() {
            buffer = Unpooled.buffer();
            buffer.writeBytes("$4\r\n".getBytes(StandardCharsets.US_ASCII));
            buffer.writeBytes(new byte[]{0, '\r', '\n', (byte) 0xFF});
            buffer.writeBytes(Resp.CRLF);

            final BulkString resp = (BulkString) Resp.decode(buffer);
            assertArrayEquals(new byte[]{0, '\r', '\n', (byte) 0xFF}, resp.getContent().getBytes());
        }

        @Test
        void testArray() {
            final RespArray resp = (RespArray) decode("*2\r\n$4\r\nECHO\r\n$3\r\nhey\r\n");
            assertEquals(2, resp.size());
            assertEquals("ECHO", resp.getContent()[0].toString());
            assertEquals("hey", resp.getContent()[1].toString());
        }

        @Test
        void testEmptyArray() {
            assertSame(RespArray.EMPTY, decode("*0\r\n"));
        }

        @Test
        @DisplayName("嵌套数组与混合类型")
        void testNestedArray() {
            final RespArray resp = (RespArray) decode("*3\r\n*2\r\n:1\r\n*0\r\n+x\r\n$1\r\ny\r\n");
            assertEquals(3, resp.size());
            final RespArray inner = (RespArray) resp.getContent()[0];
            assertEquals(1L, ((RespInteger) inner.getContent()[0]).getContent());
            assertSame(RespArray.EMPTY, inner.getContent()[1]);
            assertEquals("x", resp.getContent()[1].toString());
            assertEquals("y", resp.getContent()[2].toString());
            assertEquals(0, buffer.readableBytes());
        }

        @Test
        @DisplayName("连续消息只消费一个值")
        void testDecodeOneValueAtATime() {
            decode("+A\r\n+B\r\n");
            assertEquals("+B\r\n", buffer.toString(StandardCharsets.UTF_8));
            assertEquals("B", Resp.decode(buffer).toString());
        }
    }

    @Nested
    @DisplayName("数据不完整")
    class IncompleteTests {

        @ParameterizedTest
        @ValueSource(strings = {"", "+OK", "+OK\r", "$5\r\nhel", "$5\r\nhello", "$5\r\nhello\r",
                "*2\r\n$3\r\nfoo\r\n", "*2\r\n*1\r\n"})
        void testIncompleteReturnsNullAndKeepsIndex(final String input) {
            assertNull(decode(input));
            assertEquals(0, buffer.readerIndex());
        }

        @Test
        @DisplayName("补全数据后可以继续解码")
        void testResumeAfterMoreData() {
            assertNull(decode("*1\r\n$4\r\nPI"));
            buffer.writeBytes("NG\r\n".getBytes(StandardCharsets.US_ASCII));

            final RespArray resp = (RespArray) Resp.decode(buffer);
            assertEquals("PING", resp.getContent()[0].toString());
        }
    }

    @Nested
    @DisplayName("格式错误")
    class MalformedTests {

        @ParameterizedTest
        @ValueSource(strings = {"\r\n", "?foo\r\n", "PING\r\n", ":abc\r\n", ":-1\r\n", ":\r\n",
                "$-1\r\n", "*-1\r\n", "$x\r\n", "*1x\r\n", ":18446744073709551616\r\n",
                "$3\r\nfooXY", "+OK\rX"})
        void testMalformedInput(final String input) {
            assertThrows(RespProtocolException.class, () -> decode(input));
            assertEquals(0, buffer.readerIndex());
        }

        @Test
        @DisplayName("批量字符串长度超限")
        void testBulkLengthLimit() {
            assertThatThrownBy(() -> decode("$" + (Resp.PROTO_MAX_BULK_LEN + 1) + "\r\n"))
                    .isInstanceOf(RespProtocolException.class)
                    .hasMessageContaining("批量字符串");
        }

        @Test
        @DisplayName("数组元素数量超限")
        void testArrayLengthLimit() {
            assertThatThrownBy(() -> decode("*" + (Resp.PROTO_MAX_ARRAY_LEN + 1) + "\r\n"))
                    .isInstanceOf(RespProtocolException.class)
                    .hasMessageContaining("元素数量");
        }

        @Test
        @DisplayName("嵌套深度超限")
        void testNestingDepthLimit() {
            final StringBuilder sb = new StringBuilder();
            for (int i = 0; i <= Resp.PROTO_MAX_NESTING_DEPTH; i++) {
                sb.append("*1\r\n");
            }
            assertThatThrownBy(() -> decode(sb.toString()))
                    .isInstanceOf(RespProtocolException.class)
                    .hasMessageContaining("嵌套深度");
        }

        @Test
        @DisplayName("最大嵌套深度以内正常解码")
        void testNestingWithinLimit() {
            final StringBuilder sb = new StringBuilder();
            for (int i = 0; i < Resp.PROTO_MAX_NESTING_DEPTH; i++) {
                sb.append("*1\r\n");
            }
            sb.append(":7\r\n");

            Resp resp = decode(sb.toString());
            for (int i = 0; i < Resp.PROTO_MAX_NESTING_DEPTH; i++) {
                resp = ((RespArray) resp).getContent()[0];
            }
            assertThat(resp).isInstanceOf(RespInteger.class);
        }

        @Test
        @DisplayName("没有换行的超长行")
        void testLineLengthLimit() {
            final String longLine = "+" + "a".repeat(Resp.PROTO_MAX_LINE_LEN + 1);
            assertThrows(RespProtocolException.class, () -> decode(longLine));
        }
    }
}
