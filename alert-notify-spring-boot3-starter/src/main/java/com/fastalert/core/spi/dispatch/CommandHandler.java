package com.fastalert.core.spi.dispatch;

import com.fastalert.model.command.DeliveryCommand;

/**
 * 命令处理器, 同步方法 总线负责异步调用
 */
public interface CommandHandler<C extends DeliveryCommand> {

    Class<C> commandType();

    void handle(C command) throws Exception;
}
