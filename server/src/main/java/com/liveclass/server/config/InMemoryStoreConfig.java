package com.liveclass.server.config;

import com.liveclass.server.dao.ClassRecordStore;
import com.liveclass.server.dao.InMemoryClassRecordStore;
import com.liveclass.server.dao.InMemoryPresenceStore;
import com.liveclass.server.dao.PresenceStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Arrays;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Database-free stores for local runs: {@code classroom.store=memory}.
 */
@Configuration
@ConditionalOnProperty(name = "classroom.store", havingValue = "memory")
public class InMemoryStoreConfig {
    private static final Logger log = LoggerFactory.getLogger(InMemoryStoreConfig.class);

    @Bean
    public PresenceStore presenceStore() {
        log.info("Using in-memory presence store");
        return new InMemoryPresenceStore();
    }

    /**
     * @param classes comma separated access codes; empty means any code is accepted
     */
    @Bean
    public ClassRecordStore classRecordStore(@Value("${classroom.memory.classes:}") String classes) {
        Set<String> codes = Arrays.stream(classes.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toSet());
        return new InMemoryClassRecordStore(codes);
    }
}
