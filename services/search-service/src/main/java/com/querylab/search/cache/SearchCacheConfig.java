package com.querylab.search.cache;

import java.time.Clock;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class SearchCacheConfig {

    @Bean
    @ConditionalOnMissingBean(KeyValueStore.class)
    public KeyValueStore searchKeyValueStore(SearchCacheProperties properties, Clock clock) {
        return new InMemoryKeyValueStore(properties.getMaxEntries(), clock);
    }
}
