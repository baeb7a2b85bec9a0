package com.crossbot.service;

import com.crossbot.codec.tabular.TabularCodec;
import com.crossbot.config.CrossbotConfig;
import com.crossbot.config.RedisScenarioStore;
import com.crossbot.runtime.RuntimeMessages;
import com.crossbot.runtime.RuntimeTraversal;
import com.crossbot.scenario.compile.ClassifierVocabulary;
import com.crossbot.scenario.compile.ScenarioCompiler;
import com.crossbot.scenario.store.InMemoryScenarioStore;
import com.crossbot.scenario.store.ScenarioStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the scenario service from configuration: store by {@code CROSSBOT_STORE}, compiler and codecs
 * from the configured vocabulary and policies, runtime messages with the configured overrides.
 */
public final class ScenarioBootstrap {

    private static final Logger log = LoggerFactory.getLogger(ScenarioBootstrap.class);

    private ScenarioBootstrap() {
    }

    /** Loads {@link CrossbotConfig} from the environment and initializes from it. */
    public static ScenarioServiceContext initialize(SessionStateSetter sessionStateSetter,
                                                    NotificationTrigger notificationTrigger) {
        log.info("Bootstrap: loading configuration from environment");
        return initialize(CrossbotConfig.fromEnvironment(), sessionStateSetter, notificationTrigger);
    }

    public static ScenarioServiceContext initialize(CrossbotConfig config,
                                                    SessionStateSetter sessionStateSetter,
                                                    NotificationTrigger notificationTrigger) {
        ScenarioStore store = createStore(config);
        ClassifierVocabulary vocabulary = config.toVocabulary();
        ScenarioCompiler compiler = new ScenarioCompiler(vocabulary, config.getCyclePolicy());
        TabularCodec tabularCodec = new TabularCodec(vocabulary, config.getTabularOverflow());
        RuntimeTraversal traversal = new RuntimeTraversal(runtimeMessages(config, vocabulary));
        ScenarioMetrics metrics = ScenarioMetrics.shared();
        ScenarioService service = new ScenarioService(store, compiler, tabularCodec, traversal,
                sessionStateSetter, notificationTrigger, metrics);
        log.info("Bootstrap: scenario service ready; store={}, tenant={}, cyclePolicy={}, tabularOverflow={}, handoverKeywords={}",
                config.getStoreType(), config.getTenantId(), config.getCyclePolicy(), config.getTabularOverflow(),
                vocabulary.getHandoverKeywords().size());
        return new ScenarioServiceContext(config, store, metrics, service);
    }

    static ScenarioStore createStore(CrossbotConfig config) {
        return switch (config.getStoreType()) {
            case REDIS -> {
                log.info("Bootstrap: using Redis scenario store at {}:{} prefix={}",
                        config.getCacheHost(), config.getCachePort(), config.getTenantScenarioKeyPrefix());
                yield new RedisScenarioStore(config);
            }
            case MEMORY -> new InMemoryScenarioStore();
        };
    }

    static RuntimeMessages runtimeMessages(CrossbotConfig config, ClassifierVocabulary vocabulary) {
        String welcome = config.getWelcomeMessage() != null ? config.getWelcomeMessage() : RuntimeMessages.DEFAULT_WELCOME;
        return new RuntimeMessages(welcome, RuntimeMessages.DEFAULT_HANDOVER_NOTICE, vocabulary.getRestartLabel());
    }
}
