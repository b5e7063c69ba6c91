package com.fastalert.model.ctx;

import com.fastalert.model.view.LabelSet;

import java.time.Duration;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 调用上下文
 * 携带取消信号、截止时间以及分组标签, 由调用方创建, 可跨多次 notify 复用
 */
public final class NotifyContext {

    private final Signal signal;

    private final LabelSet groupLabels;

    private NotifyContext(Signal signal, LabelSet groupLabels) {
        this.signal = signal;
        this.groupLabels = groupLabels;
    }

    /** 永不结束的上下文, 除非显式 cancel */
    public static NotifyContext background() {
        return new NotifyContext(new Signal(new CompletableFuture<>()), LabelSet.empty());
    }

    public static NotifyContext withTimeout(Duration timeout) {
        CompletableFuture<Void> f = new CompletableFuture<>();
        f.orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS);
        return new NotifyContext(new Signal(f), LabelSet.empty());
    }

    /** 共享同一取消信号, 替换分组标签 */
    public NotifyContext withGroupLabels(Map<String, String> labels) {
        return new NotifyContext(signal, LabelSet.of(labels));
    }

    public void cancel() {
        signal.done.cancel(false);
    }

    public boolean isDone() {
        return signal.done.isDone();
    }

    /**
     * 上下文结束时执行 action, 已结束则立即执行
     *
     * @return 注销句柄, 调用方用完必须执行, 否则 action 一直挂在上下文上
     */
    public Runnable onDone(Runnable action) {
        signal.listeners.add(action);
        if (signal.done.isDone()) {
            action.run();
        }
        return () -> signal.listeners.remove(action);
    }

    /** 当前挂着的监听数, 含信号本身的依赖 */
    int pendingListeners() {
        return signal.listeners.size() + signal.done.getNumberOfDependents();
    }

    public LabelSet getGroupLabels() {
        return groupLabels;
    }

    /**
     * 结束原因, 未结束时返回 null
     */
    public String err() {
        if (!signal.done.isDone()) {
            return null;
        }
        try {
            signal.done.getNow(null);
            return "context canceled";
        } catch (CancellationException e) {
            return "context canceled";
        } catch (Exception e) {
            return e.getCause() instanceof TimeoutException ? "context deadline exceeded" : "context canceled";
        }
    }

    /**
     * done 只挂一个依赖, 监听者放在可移除的集合里
     */
    private static final class Signal {

        private final CompletableFuture<Void> done;

        private final Set<Runnable> listeners = ConcurrentHashMap.newKeySet();

        private Signal(CompletableFuture<Void> done) {
            this.done = done;
            done.whenComplete((r, e) -> listeners.forEach(Runnable::run));
        }
    }
}
