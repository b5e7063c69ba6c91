package com.fastalert.core.metric;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * 通知指标, 按渠道类型打 tag
 */
public final class NotifyMetrics {

    private final MeterRegistry reg;

    private final Counter dispatchCompleted;

    private final Counter dispatchFailed;

    private NotifyMetrics(MeterRegistry reg) {
        this.reg = reg;
        this.dispatchCompleted = Counter.builder("alert.dispatch.completed").description("commands completed").register(reg);
        this.dispatchFailed    = Counter.builder("alert.dispatch.failed").description("commands failed").register(reg);
    }

    public static NotifyMetrics create(MeterRegistry reg) { return new NotifyMetrics(reg); }

    /**
     * 写入应用中已有的全部 registry, 另带一个本地 Simple 便于直接读取
     */
    public static NotifyMetrics create(List<MeterRegistry> registries) {
        CompositeMeterRegistry composite = new CompositeMeterRegistry();
        composite.add(new SimpleMeterRegistry());
        for (MeterRegistry r : registries) {
            // 展开组合 registry, 同一个 registry 只会加入一次
            if (r instanceof CompositeMeterRegistry) {
                ((CompositeMeterRegistry) r).getRegistries().forEach(composite::add);
            } else {
                composite.add(r);
            }
        }
        return new NotifyMetrics(composite);
    }

    /** 测试或未启用监控时使用 */
    public static NotifyMetrics noop() { return new NotifyMetrics(new SimpleMeterRegistry()); }

    public void incSent(String type) { counter("alert.notify.sent", "notify sent", type).increment(); }
    public void incFailed(String type) { counter("alert.notify.failed", "notify failed", type).increment(); }
    public void incRenderFailed(String type) { counter("alert.notify.render.failed", "template render failed", type).increment(); }
    public void incCancelled(String type) { counter("alert.notify.cancelled", "notify cancelled by caller", type).increment(); }
    public void incDispatchCompleted() { dispatchCompleted.increment(); }
    public void incDispatchFailed() { dispatchFailed.increment(); }

    public void recordNotifyNanos(String type, long nanos) {
        Timer.builder("alert.notify.time").description("render and dispatch time")
                .tags(Tags.of("type", type)).register(reg)
                .record(nanos, TimeUnit.NANOSECONDS);
    }

    public MeterRegistry registry() { return reg; }

    private Counter counter(String name, String desc, String type) {
        // register 幂等, 同名同 tag 返回同一个 meter
        return Counter.builder(name).description(desc).tags(Tags.of("type", type)).register(reg);
    }
}
