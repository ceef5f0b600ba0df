package site.redislite.protocol;

import io.netty.handler.codec.CorruptedFrameException;

/**
 * RESP格式错误。
 *
 * <p>收到该异常后连接无法重新同步到下一条命令的边界，只能关闭。
 * 数据不完整不属于此类错误，解码器会返回null等待更多数据。
 *
 * @author hnfy258
 * @since 1.0.0
 */
public class RespProtocolException extends CorruptedFrameException {

    public RespProtocolException(final String message) {
        super(message);
    }
}
