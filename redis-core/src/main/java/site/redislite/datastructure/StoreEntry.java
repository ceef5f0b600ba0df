package site.redislite.datastructure;

import lombok.Getter;

/**
 * 存储条目：值和可选的绝对过期时间。
 *
 * <p>条目不可变，写入同一个键时整体替换旧条目，因此普通SET会清除之前的过期时间。
 *
 * @author hnfy258
 * @since 1.0.0
 */
@Getter
public final class StoreEntry {

    /** 永不过期 */
    public static final long NO_EXPIRE = -1L;

    private final RedisBytes value;

    /** 过期时间戳（毫秒），{@link #NO_EXPIRE} 表示永不过期 */
    private final long expireAt;

    private StoreEntry(final RedisBytes value, final long expireAt) {
        this.value = value;
        this.expireAt = expireAt;
    }

    public static StoreEntry persistent(final RedisBytes value) {
        return new StoreEntry(value, NO_EXPIRE);
    }

    public static StoreEntry expiringAt(final RedisBytes value, final long expireAt) {
        if (expireAt < 0) {
            throw new IllegalArgumentException("过期时间戳不能为负数: " + expireAt);
        }
        return new StoreEntry(value, expireAt);
    }

    public boolean hasExpiry() {
        return expireAt != NO_EXPIRE;
    }

    /**
     * 判断在给定时刻是否已过期。
     *
     * <p>到达过期时间戳即视为过期，所以TTL为0的条目在下一次读取时一定不可见。
     *
     * @param nowMillis 当前时间戳（毫秒）
     * @return 已过期返回true
     */
    public boolean isExpired(final long nowMillis) {
        return hasExpiry() && nowMillis >= expireAt;
    }
}
