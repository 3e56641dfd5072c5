package com.boxsort.config;

import com.boxsort.util.RowLockRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class AppConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    // shared by requirement rows, worker sessions and job assignment
    @Bean
    public RowLockRegistry rowLockRegistry() {
        return new RowLockRegistry();
    }
}
