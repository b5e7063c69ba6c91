package com.fastalert.core.dispatch;

import com.fastalert.config.AlertNotifyProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

import java.util.concurrent.atomic.AtomicBoolean;

public class CommandBusLifecycle implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(CommandBusLifecycle.class);

    private final InProcessCommandBus bus;

    private final AlertNotifyProperties props;

    private final AtomicBoolean running = new AtomicBoolean(false);

    public CommandBusLifecycle(InProcessCommandBus bus, AlertNotifyProperties props) {
        this.bus = bus;
        this.props = props;
    }

    @Override
    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        AlertNotifyProperties.Dispatch d = props.getDispatch();
        log.info("[CommandBus] started: core={}, max={}, queue={}, externalUrl={}",
                d.getCorePoolSize(), d.getMaxPoolSize(), d.getQueueCapacity(), props.getExternalUrl());
    }

    @Override
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            log.info("[CommandBus] stop skipped: already stopped");
            return;
        }
        log.info("[CommandBus] stopping...");
        try {
            bus.shutdown(props.getDispatch().getAwaitTermination());
        } finally {
            log.info("[CommandBus] stopped");
        }
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override public boolean isAutoStartup() { return true; }
}
