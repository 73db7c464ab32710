package com.servealert.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.servealert.persistence.KeyValueStore;
import com.servealert.persistence.RedisKeyValueStore;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * Redis-backed key-value store for persisted alert state.
 *
 * <p>Values are JSON strings written by {@link com.servealert.persistence.AlertStorageService}
 * through Spring's {@link ObjectMapper}, so a plain {@link StringRedisTemplate} is enough.
 * All keys share the configured prefix because the Redis server may be shared.
 *
 * <p>Key schema (default prefix):
 * <pre>
 *   servealert:alerts                 → alert list envelope
 *   servealert:alert-history          → resolved/dismissed alert envelope
 *   servealert:notification-settings  → settings envelope
 *   servealert:restaurant-profile     → profile envelope
 *   servealert:user-preferences       → preferences envelope
 *   servealert:permission-status      → permission envelope
 * </pre>
 */
@Configuration
public class RedisConfig {

    public static final String KEY_ALERTS = "alerts";
    public static final String KEY_ALERT_HISTORY = "alert-history";
    public static final String KEY_NOTIFICATION_SETTINGS = "notification-settings";
    public static final String KEY_RESTAURANT_PROFILE = "restaurant-profile";
    public static final String KEY_USER_PREFERENCES = "user-preferences";
    public static final String KEY_PERMISSION_STATUS = "permission-status";

    @Bean
    public KeyValueStore keyValueStore(StringRedisTemplate stringRedisTemplate, ServeAlertProperties properties) {
        return new RedisKeyValueStore(stringRedisTemplate, properties.getStorage().getKeyPrefix());
    }
}
