package com.mergeline.backend.support;

import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;

@TestConfiguration
public class InMemoryRemotesConfig {

    @Bean
    @Primary
    public InMemoryRemotes inMemoryRemotes() {
        return new InMemoryRemotes();
    }
}
