package com.mergeline.backend.remote;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class RemoteConfig {

    @Bean
    @ConditionalOnMissingBean(RemoteRepositories.class)
    public RemoteRepositories unconfiguredRemoteRepositories() {
        return new UnconfiguredRemoteRepositories();
    }
}
