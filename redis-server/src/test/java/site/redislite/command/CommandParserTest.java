package site.redislite.command;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import site.redislite.command.impl.InvalidCommand;
import site.redislite.command.impl.Ping;
import site.redislite.command.impl.server.ConfigGet;
import site.redislite.command.impl.string.Echo;
import site.redislite.command.impl.string.Get;
import site.redislite.command.impl.string.Set;
import site.redislite.core.RedisCore;
import site.redislite.datastructure.RedisBytes;
import site.redislite.protocol.BulkString;
import site.redislite.protocol.Resp;
import site.redislite.protocol.RespArray;
import site.redislite.protocol.RespInteger;
import site.redislite.protocol.SimpleString;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verifyNoInteractions;

/**
 * CommandParser 单元测试
 *
 * <p>解析阶段只做校验，不访问存储。
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("CommandParser 单元测试")
class CommandParserTest {

    @Mock
    private RedisCore redisCore;

    private CommandParser parser;

    @BeforeEach
    void setUp() {
        parser = new CommandParser(redisCore);
    }

    private static RespArray command(final String... parts) {
        final Resp[] array = new Resp[parts.length];
        for (int i = 0; i < parts.length; i++) {
            array[i] = BulkString.fromString(parts[i]);
        }
        return new RespArray(array);
    }

    private String invalidReason(final Resp request) {
        final Command command = parser.parse(request);
        assertThat(command).isInstanceOf(InvalidCommand.class);
        return ((InvalidCommand) command).getReason();
    }

    @Nested
    @DisplayName("请求结构")
    class StructureTests {

        @Test
        @DisplayName("顶层不是数组")
        void testNotAnArray() {
            assertThat(invalidReason(BulkString.fromString("PING"))).isEqualTo("ERR command must be an array");
            assertThat(invalidReason(new SimpleString("PING"))).isEqualTo("ERR command must be an array");
        }

        @Test
        @DisplayName("空数组")
        void testEmptyArray() {
            assertThat(invalidReason(RespArray.EMPTY)).isEqualTo("ERR command must be a non-empty array");
        }

        @Test
        @DisplayName("命令名不是批量字符串")
        void testNameNotBulkString() {
            assertThat(invalidReason(RespArray.valueOf(RespInteger.valueOf(1))))
                    .isEqualTo("ERR command name must be a bulk string");
        }

        @Test
        @DisplayName("未知命令")
        void testUnknownCommand() {
            assertThat(invalidReason(command("FLUSHALL"))).isEqualTo("ERR unknown command 'FLUSHALL'");
            verifyNoInteractions(redisCore);
        }

        @Test
        @DisplayName("命令名大小写不敏感")
        void testCaseInsensitiveName() {
            assertThat(parser.parse(command("pInG"))).isInstanceOf(Ping.class);
            assertThat(parser.parse(command("ping"))).isInstanceOf(Ping.class);
        }
    }

    @Nested
    @DisplayName("各命令参数校验")
    class ArgumentTests {

        @Test
        @DisplayName("PING 不接受参数")
        void testPingArity() {
            assertThat(invalidReason(command("PING", "hello")))
                    .isEqualTo("ERR wrong number of arguments for 'ping' command");
        }

        @Test
        @DisplayName("ECHO 缺少参数")
        void testEchoWithoutArgument() {
            assertThat(invalidReason(command("ECHO")))
                    .isEqualTo("ERR wrong number of arguments for 'echo' command");
        }

        @Test
        @DisplayName("ECHO 参数必须是批量字符串")
        void testEchoArgumentType() {
            final RespArray request = RespArray.valueOf(BulkString.fromString("ECHO"), RespInteger.valueOf(5));
            assertThat(invalidReason(request)).isEqualTo("ERR arguments of 'echo' command must be bulk strings");
        }

        @Test
        @DisplayName("ECHO 保留原始字节")
        void testEchoPayload() {
            final Command command = parser.parse(command("ECHO", "hey"));
            assertThat(command).isInstanceOf(Echo.class);
            assertThat(((Echo) command).getPayload()).isEqualTo(RedisBytes.fromString("hey"));
        }

        @Test
        @DisplayName("GET 参数个数")
        void testGetArity() {
            assertThat(invalidReason(command("GET")))
                    .isEqualTo("ERR wrong number of arguments for 'get' command");
            assertThat(invalidReason(command("GET", "a", "b")))
                    .isEqualTo("ERR wrong number of arguments for 'get' command");
            assertThat(((Get) parser.parse(command("get", "k"))).getKey()).isEqualTo(RedisBytes.fromString("k"));
        }

        @Test
        @DisplayName("SET 缺少值")
        void testSetWithoutValue() {
            assertThat(invalidReason(command("SET", "k")))
                    .isEqualTo("ERR wrong number of arguments for 'set' command");
            assertThat(invalidReason(command("SET", "k", "v", "px")))
                    .isEqualTo("ERR wrong number of arguments for 'set' command");
        }

        @Test
        @DisplayName("SET 不带过期时间")
        void testPlainSet() {
            final Set set = (Set) parser.parse(command("SET", "k", "v"));
            assertThat(set.getKey()).isEqualTo(RedisBytes.fromString("k"));
            assertThat(set.getValue()).isEqualTo(RedisBytes.fromString("v"));
            assertThat(set.hasExpiry()).isFalse();
        }

        @Test
        @DisplayName("SET PX 带过期时间")
        void testSetWithPx() {
            final Set set = (Set) parser.parse(command("SET", "k", "v", "px", "100"));
            assertThat(set.hasExpiry()).isTrue();
            assertThat(set.getTtlMillis()).isEqualTo(100L);
        }

        @Test
        @DisplayName("SET PX 0 是合法的")
        void testSetWithZeroPx() {
            final Set set = (Set) parser.parse(command("SET", "k", "v", "px", "0"));
            assertThat(set.hasExpiry()).isTrue();
            assertThat(set.getTtlMillis()).isZero();
        }

        @Test
        @DisplayName("SET 选项名区分大小写")
        void testSetOptionCaseSensitive() {
            assertThat(invalidReason(command("SET", "k", "v", "PX", "100"))).isEqualTo("ERR syntax error");
            assertThat(invalidReason(command("SET", "k", "v", "ex", "100"))).isEqualTo("ERR syntax error");
        }

        @Test
        @DisplayName("SET PX 值必须是无符号整数")
        void testSetInvalidTtl() {
            assertThat(invalidReason(command("SET", "k", "v", "px", "-1")))
                    .isEqualTo("ERR value is not an integer or out of range");
            assertThat(invalidReason(command("SET", "k", "v", "px", "1.5")))
                    .isEqualTo("ERR value is not an integer or out of range");
            assertThat(invalidReason(command("SET", "k", "v", "px", "")))
                    .isEqualTo("ERR value is not an integer or out of range");
            assertThat(invalidReason(command("SET", "k", "v", "px", "99999999999999999999999")))
                    .isEqualTo("ERR value is not an integer or out of range");
        }

        @Test
        @DisplayName("SET PX 超过long范围时截断")
        void testSetHugeTtl() {
            final Set set = (Set) parser.parse(command("SET", "k", "v", "px", "18446744073709551615"));
            assertThat(set.getTtlMillis()).isEqualTo(Long.MAX_VALUE);
        }

        @Test
        @DisplayName("CONFIG GET")
        void testConfigGet() {
            final ConfigGet configGet = (ConfigGet) parser.parse(command("config", "get", "DIR"));
            assertThat(configGet.getParameter()).isEqualTo("dir");

            assertThat(invalidReason(command("CONFIG", "GET", "dir")))
                    .isEqualTo("ERR unknown subcommand 'GET' for 'config' command");

            assertThat(invalidReason(command("CONFIG", "SET", "dir")))
                    .isEqualTo("ERR unknown subcommand 'SET' for 'config' command");
            assertThat(invalidReason(command("CONFIG", "get")))
                    .isEqualTo("ERR wrong number of arguments for 'config' command");
        }
    }
}
