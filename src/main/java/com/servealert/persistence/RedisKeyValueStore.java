package com.servealert.persistence;

import com.servealert.exception.StorageException;
import java.util.Optional;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;

/**
 * {@link KeyValueStore} on Redis. Every key is written under a common prefix.
 */
public class RedisKeyValueStore implements KeyValueStore {

    private final StringRedisTemplate stringRedisTemplate;
    private final String keyPrefix;

    public RedisKeyValueStore(StringRedisTemplate stringRedisTemplate, String keyPrefix) {
        this.stringRedisTemplate = stringRedisTemplate;
        this.keyPrefix = keyPrefix;
    }

    @Override
    public Optional<String> get(String key) {
        try {
            return Optional.ofNullable(stringRedisTemplate.opsForValue().get(keyPrefix + key));
        } catch (DataAccessException e) {
            throw new StorageException("read", keyPrefix + key, e);
        }
    }

    @Override
    public void put(String key, String value) {
        try {
            stringRedisTemplate.opsForValue().set(keyPrefix + key, value);
        } catch (DataAccessException e) {
            throw new StorageException("write", keyPrefix + key, e);
        }
    }

    @Override
    public void delete(String key) {
        try {
            stringRedisTemplate.delete(keyPrefix + key);
        } catch (DataAccessException e) {
            throw new StorageException("delete", keyPrefix + key, e);
        }
    }
}
