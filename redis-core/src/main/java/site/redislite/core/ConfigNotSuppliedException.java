package site.redislite.core;

/**
 * 启动时没有提供快照配置，却查询了配置项。
 *
 * @author hnfy258
 * @since 1.0.0
 */
public class ConfigNotSuppliedException extends IllegalStateException {

    public ConfigNotSuppliedException() {
        super("no configuration supplied at startup");
    }
}
