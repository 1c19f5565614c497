package com.gt.studyscheduler.store.impl;

import com.gt.studyscheduler.conf.CachingConfig;
import com.gt.studyscheduler.exception.DaoException;
import com.gt.studyscheduler.store.KeyValueStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.sql.Timestamp;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public class KeyValueStorePG implements KeyValueStore {

    private static final Logger log = LoggerFactory.getLogger(KeyValueStorePG.class);

    private static final String GET_VALUE_SQL =
            "SELECT store_value FROM study_key_value WHERE store_key = :storeKey";

    private static final String SAVE_VALUE_SQL =
            "INSERT INTO study_key_value (store_key, store_value, updated_at) " +
            "VALUES (:storeKey, :storeValue, :updatedAt) " +
            "ON CONFLICT (store_key) DO UPDATE " +
                    "SET store_value = :storeValue, updated_at = :updatedAt";

    private static final String DELETE_VALUE_SQL =
            "DELETE FROM study_key_value WHERE store_key = :storeKey";

    private final NamedParameterJdbcTemplate template;
    private final Clock clock;

    public KeyValueStorePG(NamedParameterJdbcTemplate template, Clock clock) {
        this.template = template;
        this.clock = clock;
    }

    @Override
    @Cacheable(value = CachingConfig.STUDY_STORE, key = "#key")
    public Optional<String> get(String key) {
        try {
            List<String> values = template.queryForList(GET_VALUE_SQL, Map.of("storeKey", key), String.class);

            if (values.size() == 0 || values.get(0) == null) {
                return Optional.empty();
            }

            return Optional.of(values.get(0));
        } catch (DataAccessException ex) {
            throw new DaoException("Failed to read value for key " + key, ex);
        }
    }

    @Override
    @CacheEvict(value = CachingConfig.STUDY_STORE, key = "#key")
    public void set(String key, String value) {
        try {
            int rowsUpdated = template.update(SAVE_VALUE_SQL, Map.of(
                    "storeKey", key,
                    "storeValue", value,
                    "updatedAt", Timestamp.from(clock.instant())));

            log.debug("Saved value for key {}. {} row updated.", key, rowsUpdated);
        } catch (DataAccessException ex) {
            throw new DaoException("Failed to save value for key " + key, ex);
        }
    }

    @Override
    @CacheEvict(value = CachingConfig.STUDY_STORE, key = "#key")
    public void remove(String key) {
        try {
            template.update(DELETE_VALUE_SQL, Map.of("storeKey", key));
        } catch (DataAccessException ex) {
            throw new DaoException("Failed to remove value for key " + key, ex);
        }
    }
}
