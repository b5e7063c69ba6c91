package com.fastalert.core.dispatch;

import com.fastalert.core.metric.NotifyMetrics;
import com.fastalert.core.spi.dispatch.CommandHandler;
import com.fastalert.core.spi.dispatch.DispatchChannel;
import com.fastalert.exception.AlertDispatchException;
import com.fastalert.model.command.DeliveryCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * 进程内命令总线
 * 按命令类型找到处理器, 在线程池中异步执行, 结果通过 future 返回
 */
public class InProcessCommandBus implements DispatchChannel {

    private static final Logger log = LoggerFactory.getLogger(InProcessCommandBus.class);

    private final ExecutorService exec;

    private final NotifyMetrics metrics;

    private final Map<Class<?>, CommandHandler<?>> handlers = new ConcurrentHashMap<>(8);

    public InProcessCommandBus(ExecutorService exec, List<CommandHandler<?>> handlers, NotifyMetrics metrics) {
        this.exec = exec;
        this.metrics = metrics;
        if (handlers != null) {
            handlers.forEach(this::registry);
        }
    }

    /**
     * 注册, 同一命令类型后注册的覆盖先注册的
     */
    public InProcessCommandBus registry(CommandHandler<?> handler) {
        handlers.put(handler.commandType(), handler);
        return this;
    }

    @Override
    public CompletableFuture<Void> publish(DeliveryCommand command) {
        if (command == null) {
            return CompletableFuture.failedFuture(new AlertDispatchException("command must not be null"));
        }
        CommandHandler<?> handler = handlers.get(command.getClass());
        if (handler == null) {
            metrics.incDispatchFailed();
            log.warn("[CommandBus] no handler for command={}", command.commandName());
            return CompletableFuture.failedFuture(
                    new AlertDispatchException("no handler registered for command " + command.commandName()));
        }

        CompletableFuture<Void> f = new CompletableFuture<>();
        try {
            exec.execute(() -> run(handler, command, f));
        } catch (RejectedExecutionException e) {
            // 队列满或已关闭
            metrics.incDispatchFailed();
            log.error("[CommandBus] command={} rejected", command.commandName(), e);
            f.completeExceptionally(new AlertDispatchException("command " + command.commandName() + " rejected by dispatch executor", e));
        }
        return f;
    }

    private <C extends DeliveryCommand> void run(CommandHandler<C> handler, DeliveryCommand command, CompletableFuture<Void> f) {
        if (f.isDone()) {
            return;
        }
        try {
            handler.handle(handler.commandType().cast(command));
            metrics.incDispatchCompleted();
            f.complete(null);
        } catch (Exception e) {
            metrics.incDispatchFailed();
            log.error("[CommandBus] command={} failed", command.commandName(), e);
            f.completeExceptionally(e);
        } catch (Error e) {
            // 先结束 future, 再交给线程的 uncaught handler
            metrics.incDispatchFailed();
            f.completeExceptionally(e);
            throw e;
        }
    }

    /**
     * 停止接收新命令, 等待在途命令完成
     */
    public void shutdown(Duration await) {
        exec.shutdown();
        try {
            if (!exec.awaitTermination(await.toMillis(), TimeUnit.MILLISECONDS)) {
                List<Runnable> dropped = exec.shutdownNow();
                log.warn("[CommandBus] shutdown timed out, {} queued commands dropped", dropped.size());
            }
        } catch (InterruptedException e) {
            exec.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public boolean isShutdown() {
        return exec.isShutdown();
    }
}
