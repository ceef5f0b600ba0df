package site.redislite.core;

import lombok.Getter;
import lombok.ToString;

/**
 * 启动时提供的快照路径配置，只用于 CONFIG GET 查询，不读写任何文件。
 *
 * @author hnfy258
 * @since 1.0.0
 */
@Getter
@ToString
public final class SnapshotConfig {

    public static final String DEFAULT_DB_FILENAME = "dump.rdb";

    /** 快照目录，未指定时为null */
    private final String dir;

    private final String dbFileName;

    private SnapshotConfig(final String dir, final String dbFileName) {
        this.dir = dir;
        this.dbFileName = dbFileName;
    }

    /**
     * 创建配置。
     *
     * @param dir        快照目录，可以为null
     * @param dbFileName 快照文件名，为null时使用 {@value #DEFAULT_DB_FILENAME}
     * @return 配置实例
     */
    public static SnapshotConfig of(final String dir, final String dbFileName) {
        return new SnapshotConfig(dir, dbFileName == null ? DEFAULT_DB_FILENAME : dbFileName);
    }
}
