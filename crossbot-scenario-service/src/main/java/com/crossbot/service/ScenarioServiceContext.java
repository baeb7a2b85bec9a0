package com.crossbot.service;

import com.crossbot.config.CrossbotConfig;
import com.crossbot.runtime.session.AutoResponseTimers;
import com.crossbot.scenario.store.ScenarioStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.function.Predicate;

/**
 * Everything built at bootstrap: configuration, store, metrics and the service. Closing it releases
 * the store when the store holds connections.
 */
public final class ScenarioServiceContext implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ScenarioServiceContext.class);

    private final CrossbotConfig config;
    private final ScenarioStore store;
    private final ScenarioMetrics metrics;
    private final ScenarioService service;

    ScenarioServiceContext(CrossbotConfig config, ScenarioStore store, ScenarioMetrics metrics, ScenarioService service) {
        this.config = Objects.requireNonNull(config, "config");
        this.store = Objects.requireNonNull(store, "store");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.service = Objects.requireNonNull(service, "service");
    }

    public CrossbotConfig getConfig() {
        return config;
    }

    public ScenarioStore getStore() {
        return store;
    }

    public ScenarioMetrics getMetrics() {
        return metrics;
    }

    public ScenarioService getService() {
        return service;
    }

    /**
     * Timer registry sized by {@code CROSSBOT_AUTO_RESPONSE_THREADS}. The caller owns it and closes it.
     *
     * @param awaitingHuman whether a session currently waits for a human operator
     */
    public AutoResponseTimers newAutoResponseTimers(Predicate<String> awaitingHuman) {
        return new AutoResponseTimers(config.getAutoResponseThreads(), awaitingHuman);
    }

    @Override
    public void close() {
        if (store instanceof AutoCloseable closeable) {
            try {
                closeable.close();
            } catch (Exception e) {
                log.warn("ScenarioServiceContext | store close failed | error={}", e.toString(), e);
            }
        }
    }
}
