package com.gt.flashcard.conf;

import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.concurrent.ConcurrentMapCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableCaching
public class CachingConfig {

    public static final String LEARNING_CONFIG = "learning_config";

    @Bean
    public CacheManager getLearningConfigCacheManager() {
        return new ConcurrentMapCacheManager(LEARNING_CONFIG);
    }
}
