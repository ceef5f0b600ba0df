package site.redislite.command;

import site.redislite.protocol.Resp;

/**
 * Redis命令接口，定义了所有Redis命令的基本行为。
 *
 * <p>命令的生命周期分为两步：
 * <ul>
 *   <li>{@link #setContext(Resp[])} 校验参数并保存解析结果，不访问存储
 *   <li>{@link #handle()} 对共享存储执行操作并生成回复
 * </ul>
 *
 * <p>命令实例只在一次请求中使用，不在连接之间共享。
 *
 * @author hnfy258
 * @since 1.0
 */
public interface Command {

    /**
     * 获取命令类型。
     *
     * @return 命令类型枚举值，校验失败的命令返回null
     */
    CommandType getType();

    /**
     * 校验并保存命令参数。
     *
     * @param array 完整的命令数组，第0个元素是命令名
     * @throws CommandValidationException 参数个数或类型不符合要求时
     */
    void setContext(Resp[] array);

    /**
     * 执行命令并返回结果。
     *
     * @return RESP协议格式的执行结果
     */
    Resp handle();
}
