package com.gt.studyscheduler.conf;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.concurrent.ConcurrentMapCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;

/**
 * Read-through cache in front of the key-value store. Writes and removals evict their key, and the whole cache is
 * flushed periodically so changes made by another process are eventually seen.
 */
@Configuration
@EnableCaching
@EnableScheduling
public class CachingConfig {

    private static final Logger log = LoggerFactory.getLogger(CachingConfig.class);

    public static final String STUDY_STORE = "study_store";
    private static final long CACHE_EVICT_SCHEDULE_MS = 15 * 60 * 1000;

    @Bean
    public CacheManager getStudyStoreCacheManager() {
        return new ConcurrentMapCacheManager(STUDY_STORE);
    }

    @CacheEvict(allEntries = true, value = STUDY_STORE)
    @Scheduled(fixedDelay = CACHE_EVICT_SCHEDULE_MS, initialDelay = CACHE_EVICT_SCHEDULE_MS)
    public void reportStudyStoreCacheEvict() {
        log.info("Flushing " + STUDY_STORE + " cache.");
    }
}
