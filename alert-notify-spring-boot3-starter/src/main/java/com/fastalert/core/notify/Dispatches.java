package com.fastalert.core.notify;

import com.fastalert.core.spi.dispatch.DispatchChannel;
import com.fastalert.exception.AlertDispatchException;
import com.fastalert.exception.NotifyCancelledException;
import com.fastalert.model.command.DeliveryCommand;
import com.fastalert.model.ctx.NotifyContext;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * 发布命令并等待结果, 各渠道共用
 * 每次 notify 只发布一次, 不重试
 */
public final class Dispatches {

    private Dispatches() {}

    public static void publishAndAwait(DispatchChannel channel, DeliveryCommand command, NotifyContext ctx) {
        String name = command.commandName();
        if (ctx.isDone()) {
            throw new NotifyCancelledException(ctx.err() + ", " + name + " not published");
        }

        CompletableFuture<Void> published;
        try {
            published = channel.publish(command);
        } catch (RuntimeException e) {
            throw new AlertDispatchException("failed to publish " + name + ": " + e.getMessage(), e);
        }
        if (published == null) {
            throw new AlertDispatchException("dispatch channel returned no result for " + name);
        }

        // 任一完成即返回; 每次调用单独的 waiter, 结束后从上下文注销
        CompletableFuture<Void> waiter = new CompletableFuture<>();
        published.whenComplete((r, e) -> waiter.complete(null));
        Runnable unregister = ctx.onDone(() -> waiter.complete(null));
        try {
            waiter.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new NotifyCancelledException("interrupted while waiting for " + name, e);
        } catch (ExecutionException e) {
            throw new AlertDispatchException("failed waiting for " + name, e.getCause());
        } finally {
            unregister.run();
        }

        // 两者同时完成时以投递结果为准
        if (!published.isDone()) {
            throw new NotifyCancelledException(ctx.err() + " while waiting for " + name);
        }
        try {
            published.join();
        } catch (CancellationException e) {
            throw new AlertDispatchException(name + " was cancelled by the dispatch channel", e);
        } catch (CompletionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            throw new AlertDispatchException(name + " failed: " + cause.getMessage(), cause);
        }
    }
}
