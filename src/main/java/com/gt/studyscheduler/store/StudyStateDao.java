package com.gt.studyscheduler.store;

import com.gt.studyscheduler.exception.DaoException;
import com.gt.studyscheduler.exception.MappingException;
import com.gt.studyscheduler.model.CardMemoryState;
import com.gt.studyscheduler.model.FlashcardSetSchedule;
import com.gt.studyscheduler.model.MemorySnapshot;
import com.gt.studyscheduler.model.StudySession;
import com.gt.studyscheduler.serialization.StudyStateCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Loads and saves whole collections of scheduler state. Each collection is read, changed in memory and written
 * back in full, so with more than one writer the last write wins.
 *
 * Reads never fail: storage errors and unreadable data are logged and an empty collection is returned. Writes
 * report failure through their return value after logging it.
 */
@Component
public class StudyStateDao {

    private static final Logger log = LoggerFactory.getLogger(StudyStateDao.class);

    static final String MEMORY_DATA_KEY = "spaced_repetition_memory_data";
    static final String STUDY_SESSIONS_KEY = "study_sessions";
    static final String FLASHCARD_SETS_KEY = "flashcard_sets";

    private final KeyValueStore keyValueStore;
    private final StudyStateCodec codec;
    private final String keyPrefix;

    @Autowired
    public StudyStateDao(KeyValueStore keyValueStore,
                         StudyStateCodec codec,
                         @Value("${studyscheduler.store.keyPrefix:}") String keyPrefix) {
        this.keyValueStore = keyValueStore;
        this.codec = codec;
        this.keyPrefix = keyPrefix == null ? "" : keyPrefix;
    }

    public MemorySnapshot loadMemorySnapshot() {
        return new MemorySnapshot(loadList(MEMORY_DATA_KEY, CardMemoryState.class));
    }

    public boolean saveMemorySnapshot(MemorySnapshot snapshot) {
        return saveList(MEMORY_DATA_KEY, snapshot.states());
    }

    public List<StudySession> loadStudySessions() {
        return loadList(STUDY_SESSIONS_KEY, StudySession.class);
    }

    public boolean saveStudySessions(List<StudySession> sessions) {
        return saveList(STUDY_SESSIONS_KEY, sessions);
    }

    public boolean clearStudySessions() {
        return removeKey(STUDY_SESSIONS_KEY);
    }

    public List<FlashcardSetSchedule> loadFlashcardSets() {
        return loadList(FLASHCARD_SETS_KEY, FlashcardSetSchedule.class);
    }

    public boolean saveFlashcardSets(List<FlashcardSetSchedule> flashcardSets) {
        return saveList(FLASHCARD_SETS_KEY, flashcardSets);
    }

    private <T> List<T> loadList(String key, Class<T> recordType) {
        String storeKey = keyPrefix + key;

        try {
            Optional<String> storedValue = keyValueStore.get(storeKey);
            if (storedValue.isEmpty() || storedValue.get().isBlank()) {
                return List.of();
            }

            return List.copyOf(codec.decodeList(storedValue.get(), recordType));
        } catch (DaoException ex) {
            log.warn("Unable to load {}, continuing with no stored data", storeKey, ex);
        } catch (MappingException ex) {
            log.error("Stored value for {} is unreadable, continuing with no stored data", storeKey, ex);
        }

        return List.of();
    }

    private <T> boolean saveList(String key, List<T> records) {
        String storeKey = keyPrefix + key;

        try {
            keyValueStore.set(storeKey, codec.encodeList(records));
            return true;
        } catch (DaoException | MappingException ex) {
            log.error("Failed to save {} records to {}", records.size(), storeKey, ex);
            return false;
        }
    }

    private boolean removeKey(String key) {
        String storeKey = keyPrefix + key;

        try {
            keyValueStore.remove(storeKey);
            return true;
        } catch (DaoException ex) {
            log.error("Failed to remove {}", storeKey, ex);
            return false;
        }
    }
}
