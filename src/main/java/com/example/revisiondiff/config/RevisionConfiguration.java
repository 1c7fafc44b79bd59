package com.example.revisiondiff.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class RevisionConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
