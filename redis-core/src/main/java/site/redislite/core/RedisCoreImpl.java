package site.redislite.core;

import lombok.extern.slf4j.Slf4j;
import site.redislite.database.RedisDB;
import site.redislite.datastructure.RedisBytes;
import site.redislite.datastructure.StoreEntry;

import java.time.Clock;
import java.util.Locale;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Redis核心数据操作实现类
 *
 * <h2>线程安全设计：</h2>
 * <ul>
 *     <li>整个键空间由一把读写锁保护，不做按键加锁</li>
 *     <li>GET 持有读锁，多个读操作可以并发</li>
 *     <li>SET 以及惰性过期删除持有写锁</li>
 *     <li>过期删除在释放读锁后重新获取写锁，并确认条目没有被并发替换</li>
 * </ul>
 *
 * <p>快照配置在构造时确定，之后不再修改，读取时不需要加锁。
 *
 * @author hnfy258
 * @since 1.0.0
 */
@Slf4j
public class RedisCoreImpl implements RedisCore {

    private final RedisDB db = new RedisDB();

    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    /** 启动配置，null表示启动时没有提供 */
    private final SnapshotConfig snapshotConfig;

    private final Clock clock;

    public RedisCoreImpl(final SnapshotConfig snapshotConfig) {
        this(snapshotConfig, Clock.systemUTC());
    }

    /**
     * 构造函数
     *
     * @param snapshotConfig 启动配置，可以为null
     * @param clock          过期判断使用的时钟
     */
    public RedisCoreImpl(final SnapshotConfig snapshotConfig, final Clock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("Clock不能为null");
        }
        this.snapshotConfig = snapshotConfig;
        this.clock = clock;
    }

    @Override
    public RedisBytes get(final RedisBytes key) {
        final StoreEntry entry;
        lock.readLock().lock();
        try {
            entry = db.get(key);
            if (entry == null) {
                return null;
            }
            if (!entry.isExpired(clock.millis())) {
                return entry.getValue();
            }
        } finally {
            lock.readLock().unlock();
        }

        removeExpired(key, entry);
        return null;
    }

    /**
     * 在写锁下删除已过期的条目。
     *
     * <p>释放读锁到获取写锁之间，其他连接可能已经写入了新值，
     * 因此只删除仍然是同一个条目的映射。
     */
    private void removeExpired(final RedisBytes key, final StoreEntry expired) {
        lock.writeLock().lock();
        try {
            if (db.remove(key, expired)) {
                log.debug("惰性删除过期键: {}", key);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void set(final RedisBytes key, final RedisBytes value) {
        lock.writeLock().lock();
        try {
            db.put(key, StoreEntry.persistent(value));
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void setWithExpiry(final RedisBytes key, final RedisBytes value, final long ttlMillis) {
        if (ttlMillis < 0) {
            throw new IllegalArgumentException("过期时间不能为负数: " + ttlMillis);
        }
        lock.writeLock().lock();
        try {
            final long now = clock.millis();
            // 溢出时截断为永远不会到达的时间戳
            final long expireAt = now > Long.MAX_VALUE - ttlMillis ? Long.MAX_VALUE : now + ttlMillis;
            db.put(key, StoreEntry.expiringAt(value, expireAt));
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public String configGet(final String name) {
        if (snapshotConfig == null) {
            throw new ConfigNotSuppliedException();
        }
        switch (name.toLowerCase(Locale.ROOT)) {
            case "dir":
                return snapshotConfig.getDir();
            case "dbfilename":
                return snapshotConfig.getDbFileName();
            default:
                return null;
        }
    }

    @Override
    public int size() {
        lock.readLock().lock();
        try {
            return db.size();
        } finally {
            lock.readLock().unlock();
        }
    }
}
