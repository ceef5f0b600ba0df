package site.redislite.server;

/**
 * 服务器启动失败，例如端口已被占用。
 *
 * @author hnfy258
 */
public class ServerStartException extends RuntimeException {

    public ServerStartException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
