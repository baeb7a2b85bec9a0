package com.crossbot.config;

import com.crossbot.scenario.ScenarioDefinition;
import com.crossbot.scenario.ScenarioJson;
import com.crossbot.scenario.store.ScenarioStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.JedisPoolConfig;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Redis-backed {@link ScenarioStore}. Each definition is stored as JSON under
 * {@code <prefix>:<definitionId>}; the ids are kept in the set {@code <prefix>:index}.
 */
public final class RedisScenarioStore implements ScenarioStore, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RedisScenarioStore.class);

    static final String INDEX_SUFFIX = ":index";

    private final JedisPool pool;
    private final String keyPrefix;

    public RedisScenarioStore(CrossbotConfig config) {
        this(Objects.requireNonNull(config, "config").getCacheHost(), config.getCachePort(),
                config.getTenantScenarioKeyPrefix());
    }

    public RedisScenarioStore(String cacheHost, int cachePort, String keyPrefix) {
        this.pool = new JedisPool(new JedisPoolConfig(), cacheHost, cachePort);
        this.keyPrefix = Objects.requireNonNull(keyPrefix, "keyPrefix");
        log.debug("RedisScenarioStore connected to {}:{} prefix={}", cacheHost, cachePort, keyPrefix);
    }

    static String definitionKey(String keyPrefix, String definitionId) {
        return keyPrefix + ":" + definitionId;
    }

    static String indexKey(String keyPrefix) {
        return keyPrefix + INDEX_SUFFIX;
    }

    @Override
    public void save(ScenarioDefinition definition) {
        String key = definitionKey(keyPrefix, definition.getId());
        try (var jedis = pool.getResource()) {
            jedis.set(key, ScenarioJson.toJson(definition));
            jedis.sadd(indexKey(keyPrefix), definition.getId());
        }
        log.debug("Wrote scenario definition to Redis key={} version={}", key, definition.getVersion());
    }

    @Override
    public Optional<ScenarioDefinition> find(String definitionId) {
        if (definitionId == null) return Optional.empty();
        try (var jedis = pool.getResource()) {
            String json = jedis.get(definitionKey(keyPrefix, definitionId));
            return Optional.ofNullable(json).map(ScenarioJson::definitionFromJson);
        }
    }

    @Override
    public List<String> listIds() {
        try (var jedis = pool.getResource()) {
            List<String> ids = new ArrayList<>(jedis.smembers(indexKey(keyPrefix)));
            ids.sort(null);
            return ids;
        }
    }

    @Override
    public boolean delete(String definitionId) {
        if (definitionId == null) return false;
        try (var jedis = pool.getResource()) {
            jedis.srem(indexKey(keyPrefix), definitionId);
            boolean removed = jedis.del(definitionKey(keyPrefix, definitionId)) > 0;
            log.debug("Deleted scenario definition from Redis id={} removed={}", definitionId, removed);
            return removed;
        }
    }

    @Override
    public void close() {
        pool.close();
    }
}
