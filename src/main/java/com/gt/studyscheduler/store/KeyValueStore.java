package com.gt.studyscheduler.store;

import java.util.Optional;

/**
 * String key-value storage backing the scheduler state. Implementations report storage failures by throwing
 * {@link com.gt.studyscheduler.exception.DaoException}.
 */
public interface KeyValueStore {

    Optional<String> get(String key);

    void set(String key, String value);

    void remove(String key);
}
