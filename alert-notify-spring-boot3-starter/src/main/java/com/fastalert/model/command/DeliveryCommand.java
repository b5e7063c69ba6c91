package com.fastalert.model.command;

/**
 * 交给 DispatchChannel 执行的投递命令, 实现类必须不可变
 */
public interface DeliveryCommand {

    /** 命令名, 用于日志与指标 */
    String commandName();
}
