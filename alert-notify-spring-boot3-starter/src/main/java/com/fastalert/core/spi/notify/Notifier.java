package com.fastalert.core.spi.notify;

import com.fastalert.model.Alert;
import com.fastalert.model.ctx.NotifyContext;

import java.util.List;

/**
 * 告警通知器, 每种渠道一个实现
 * 构造即完成配置校验, 实例只存在于可用状态
 */
public interface Notifier {

    /**
     * 渠道实例名, 用于日志与指标纬度
     */
    String name();

    /**
     * 渠道类型, 如 email
     */
    String type();

    /**
     * 渲染并投递一批告警, 阻塞到投递结果返回或上下文结束
     *
     * @return true 表示投递成功; 失败抛出 AlertRenderException / AlertDispatchException
     */
    boolean notify(NotifyContext ctx, List<Alert> alerts);

    default boolean notify(NotifyContext ctx, Alert... alerts) {
        return notify(ctx, List.of(alerts));
    }
}
