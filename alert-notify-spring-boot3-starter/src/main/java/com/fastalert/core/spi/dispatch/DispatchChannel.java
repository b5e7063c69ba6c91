package com.fastalert.core.spi.dispatch;

import com.fastalert.model.command.DeliveryCommand;

import java.util.concurrent.CompletableFuture;

/**
 * 投递命令总线
 * 执行方式(同步/排队异步)由实现决定, 调用方只关心返回的 future
 */
public interface DispatchChannel {

    /**
     * 发布命令
     *
     * @return 命令执行完成时正常结束, 失败时异常结束
     */
    CompletableFuture<Void> publish(DeliveryCommand command);
}
