package site.redislite.database;

import site.redislite.datastructure.RedisBytes;
import site.redislite.datastructure.StoreEntry;

import java.util.HashMap;
import java.util.Map;

/**
 * 单个数据库的键空间。
 *
 * <p>本类本身不做同步，所有访问都必须由 {@code RedisCoreImpl} 持有的读写锁保护。
 *
 * @author hnfy258
 * @since 1.0.0
 */
public class RedisDB {

    private final Map<RedisBytes, StoreEntry> data = new HashMap<>();

    public StoreEntry get(final RedisBytes key) {
        return data.get(key);
    }

    /**
     * 存储条目，覆盖已有条目。
     *
     * @return 被覆盖的旧条目，不存在时返回null
     */
    public StoreEntry put(final RedisBytes key, final StoreEntry entry) {
        return data.put(key, entry);
    }

    /**
     * 仅当键仍映射到给定条目时删除。
     *
     * @return 删除成功返回true
     */
    public boolean remove(final RedisBytes key, final StoreEntry expected) {
        return data.remove(key, expected);
    }

    public int size() {
        return data.size();
    }
}
