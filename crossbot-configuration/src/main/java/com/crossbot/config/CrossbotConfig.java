package com.crossbot.config;

import com.crossbot.codec.tabular.DepthOverflowPolicy;
import com.crossbot.scenario.compile.ClassifierVocabulary;
import com.crossbot.scenario.compile.CyclePolicy;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Configuration loaded from environment variables for the crossbot scenario service.
 * <p>
 * Store: CROSSBOT_STORE ({@code memory} or {@code redis}); Redis at CROSSBOT_CACHE_HOST, CROSSBOT_CACHE_PORT,
 * definitions under CROSSBOT_SCENARIO_KEY_PREFIX scoped by CROSSBOT_TENANT_ID.
 * <p>
 * Compiler: CROSSBOT_CYCLE_POLICY, CROSSBOT_TABULAR_OVERFLOW, CROSSBOT_HANDOVER_KEYWORDS (comma-separated),
 * CROSSBOT_RESTART_LABEL. Runtime: CROSSBOT_WELCOME_MESSAGE, CROSSBOT_AUTO_RESPONSE_THREADS.
 */
public final class CrossbotConfig {

    static final String ENV_CACHE_HOST = "CROSSBOT_CACHE_HOST";
    static final String ENV_CACHE_PORT = "CROSSBOT_CACHE_PORT";
    static final String ENV_STORE = "CROSSBOT_STORE";
    static final String ENV_SCENARIO_KEY_PREFIX = "CROSSBOT_SCENARIO_KEY_PREFIX";
    static final String ENV_TENANT_ID = "CROSSBOT_TENANT_ID";
    static final String ENV_CYCLE_POLICY = "CROSSBOT_CYCLE_POLICY";
    static final String ENV_TABULAR_OVERFLOW = "CROSSBOT_TABULAR_OVERFLOW";
    static final String ENV_HANDOVER_KEYWORDS = "CROSSBOT_HANDOVER_KEYWORDS";
    static final String ENV_RESTART_LABEL = "CROSSBOT_RESTART_LABEL";
    static final String ENV_WELCOME_MESSAGE = "CROSSBOT_WELCOME_MESSAGE";
    static final String ENV_AUTO_RESPONSE_THREADS = "CROSSBOT_AUTO_RESPONSE_THREADS";

    private static final String DEFAULT_TENANT_ID = "default";
    private static final String TENANT_PLACEHOLDER = "<tenant>";
    private static final String DEFAULT_SCENARIO_KEY_PREFIX = "<tenant>:crossbot:scenario";
    private static final int DEFAULT_AUTO_RESPONSE_THREADS = 2;

    private final String cacheHost;
    private final int cachePort;
    private final StoreType storeType;
    private final String scenarioKeyPrefix;
    private final String tenantId;
    private final CyclePolicy cyclePolicy;
    private final DepthOverflowPolicy tabularOverflow;
    private final List<String> handoverKeywords;
    private final String restartLabel;
    private final String welcomeMessage;
    private final int autoResponseThreads;

    private CrossbotConfig(Builder b) {
        this.cacheHost = b.cacheHost;
        this.cachePort = b.cachePort;
        this.storeType = b.storeType;
        this.scenarioKeyPrefix = b.scenarioKeyPrefix;
        this.tenantId = normalizeTenantId(b.tenantId);
        this.cyclePolicy = b.cyclePolicy;
        this.tabularOverflow = b.tabularOverflow;
        this.handoverKeywords = Collections.unmodifiableList(new ArrayList<>(b.handoverKeywords));
        this.restartLabel = b.restartLabel;
        this.welcomeMessage = b.welcomeMessage;
        this.autoResponseThreads = b.autoResponseThreads;
    }

    /** Null or blank → {@value #DEFAULT_TENANT_ID}. */
    public static String normalizeTenantId(String tenantId) {
        return tenantId == null || tenantId.isBlank() ? DEFAULT_TENANT_ID : tenantId.trim();
    }

    public String getCacheHost() {
        return cacheHost;
    }

    public int getCachePort() {
        return cachePort;
    }

    public StoreType getStoreType() {
        return storeType;
    }

    /** Unscoped prefix, possibly containing {@code <tenant>}. Default {@code <tenant>:crossbot:scenario}. */
    public String getScenarioKeyPrefix() {
        return scenarioKeyPrefix;
    }

    /**
     * Scenario key prefix for the configured tenant, e.g. {@code default:crossbot:scenario}.
     */
    public String getTenantScenarioKeyPrefix() {
        return getScenarioKeyPrefix(tenantId);
    }

    public String getScenarioKeyPrefix(String tenantId) {
        String tenant = normalizeTenantId(tenantId);
        return scenarioKeyPrefix.contains(TENANT_PLACEHOLDER)
                ? scenarioKeyPrefix.replace(TENANT_PLACEHOLDER, tenant)
                : scenarioKeyPrefix;
    }

    public String getTenantId() {
        return tenantId;
    }

    public CyclePolicy getCyclePolicy() {
        return cyclePolicy;
    }

    public DepthOverflowPolicy getTabularOverflow() {
        return tabularOverflow;
    }

    public List<String> getHandoverKeywords() {
        return handoverKeywords;
    }

    /** Null when not configured (the vocabulary default applies). */
    public String getRestartLabel() {
        return restartLabel;
    }

    /** Null when not configured (the runtime default applies). */
    public String getWelcomeMessage() {
        return welcomeMessage;
    }

    public int getAutoResponseThreads() {
        return autoResponseThreads;
    }

    /** Classifier vocabulary with the configured hand-off keywords and restart label. */
    public ClassifierVocabulary toVocabulary() {
        return ClassifierVocabulary.builder()
                .handoverKeywords(handoverKeywords)
                .restartLabel(restartLabel)
                .build();
    }

    public static CrossbotConfig fromEnvironment() {
        return fromEnvironment(System::getenv);
    }

    /** Reads the variables through {@code env} (tests pass a map lookup). */
    public static CrossbotConfig fromEnvironment(Function<String, String> env) {
        return builder()
                .cacheHost(getEnv(env, ENV_CACHE_HOST, "localhost"))
                .cachePort(parseInt(env.apply(ENV_CACHE_PORT), 6379))
                .storeType(StoreType.fromValue(env.apply(ENV_STORE), StoreType.MEMORY))
                .scenarioKeyPrefix(getEnv(env, ENV_SCENARIO_KEY_PREFIX, DEFAULT_SCENARIO_KEY_PREFIX))
                .tenantId(getEnv(env, ENV_TENANT_ID, DEFAULT_TENANT_ID))
                .cyclePolicy(CyclePolicy.fromValue(env.apply(ENV_CYCLE_POLICY), CyclePolicy.SKIP))
                .tabularOverflow(DepthOverflowPolicy.fromValue(env.apply(ENV_TABULAR_OVERFLOW), DepthOverflowPolicy.REJECT))
                .handoverKeywords(parseCommaSeparated(env.apply(ENV_HANDOVER_KEYWORDS)))
                .restartLabel(getEnv(env, ENV_RESTART_LABEL, null))
                .welcomeMessage(getEnv(env, ENV_WELCOME_MESSAGE, null))
                .autoResponseThreads(parseInt(env.apply(ENV_AUTO_RESPONSE_THREADS), DEFAULT_AUTO_RESPONSE_THREADS))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    private static List<String> parseCommaSeparated(String value) {
        if (value == null || value.isBlank()) {
            return List.of();
        }
        return Stream.of(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
    }

    private static int parseInt(String value, int defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    private static String getEnv(Function<String, String> env, String key, String defaultValue) {
        String v = env.apply(key);
        return (v != null && !v.isBlank()) ? v.trim() : defaultValue;
    }

    public static final class Builder {
        private String cacheHost = "localhost";
        private int cachePort = 6379;
        private StoreType storeType = StoreType.MEMORY;
        private String scenarioKeyPrefix = DEFAULT_SCENARIO_KEY_PREFIX;
        private String tenantId = DEFAULT_TENANT_ID;
        private CyclePolicy cyclePolicy = CyclePolicy.SKIP;
        private DepthOverflowPolicy tabularOverflow = DepthOverflowPolicy.REJECT;
        private List<String> handoverKeywords = List.of();
        private String restartLabel;
        private String welcomeMessage;
        private int autoResponseThreads = DEFAULT_AUTO_RESPONSE_THREADS;

        public Builder cacheHost(String cacheHost) {
            this.cacheHost = cacheHost;
            return this;
        }

        public Builder cachePort(int cachePort) {
            this.cachePort = cachePort;
            return this;
        }

        public Builder storeType(StoreType storeType) {
            this.storeType = Objects.requireNonNull(storeType, "storeType");
            return this;
        }

        public Builder scenarioKeyPrefix(String scenarioKeyPrefix) {
            this.scenarioKeyPrefix = scenarioKeyPrefix != null ? scenarioKeyPrefix : DEFAULT_SCENARIO_KEY_PREFIX;
            return this;
        }

        public Builder tenantId(String tenantId) {
            this.tenantId = tenantId;
            return this;
        }

        public Builder cyclePolicy(CyclePolicy cyclePolicy) {
            this.cyclePolicy = cyclePolicy != null ? cyclePolicy : CyclePolicy.SKIP;
            return this;
        }

        public Builder tabularOverflow(DepthOverflowPolicy tabularOverflow) {
            this.tabularOverflow = tabularOverflow != null ? tabularOverflow : DepthOverflowPolicy.REJECT;
            return this;
        }

        public Builder handoverKeywords(List<String> handoverKeywords) {
            this.handoverKeywords = handoverKeywords != null ? new ArrayList<>(handoverKeywords) : List.of();
            return this;
        }

        public Builder restartLabel(String restartLabel) {
            this.restartLabel = restartLabel;
            return this;
        }

        public Builder welcomeMessage(String welcomeMessage) {
            this.welcomeMessage = welcomeMessage;
            return this;
        }

        public Builder autoResponseThreads(int autoResponseThreads) {
            this.autoResponseThreads = Math.max(1, autoResponseThreads);
            return this;
        }

        public CrossbotConfig build() {
            return new CrossbotConfig(this);
        }
    }
}
