package site.redislite.core;

import site.redislite.datastructure.RedisBytes;

/**
 * Redis核心操作接口
 *
 * <p>所有连接共享同一个实例。每个方法相对其他方法是原子的，
 * 但多个方法调用之间没有事务保证。
 *
 * <p>主要功能包括：
 * <ul>
 *     <li>键值对的读写，写入时后写者胜出</li>
 *     <li>基于读取时检查的惰性过期，没有后台清理线程</li>
 *     <li>启动配置的只读查询</li>
 * </ul>
 *
 * @author hnfy258
 * @since 1.0.0
 */
public interface RedisCore {

    /**
     * 获取键对应的值。
     *
     * <p>已过期的条目视为不存在，并在返回前被删除。
     *
     * @param key 键
     * @return 值，不存在或已过期时返回null
     */
    RedisBytes get(RedisBytes key);

    /**
     * 存储键值对，覆盖已有条目并清除其过期时间。
     *
     * @param key   键
     * @param value 值
     */
    void set(RedisBytes key, RedisBytes value);

    /**
     * 存储键值对，并在 {@code ttlMillis} 毫秒后过期。
     *
     * <p>{@code ttlMillis} 为0时，下一次读取即不可见。
     *
     * @param key       键
     * @param value     值
     * @param ttlMillis 相对过期时间（毫秒）
     * @throws IllegalArgumentException 如果ttlMillis为负数
     */
    void setWithExpiry(RedisBytes key, RedisBytes value, long ttlMillis);

    /**
     * 查询启动配置项，支持 {@code dir} 和 {@code dbfilename}。
     *
     * @param name 配置项名称（大小写不敏感）
     * @return 配置值，未知配置项或未设置时返回null
     * @throws ConfigNotSuppliedException 如果启动时没有提供任何配置
     */
    String configGet(String name);

    /**
     * 获取键空间中的条目数量，包含尚未被惰性删除的过期条目。
     *
     * @return 条目数量
     */
    int size();
}
