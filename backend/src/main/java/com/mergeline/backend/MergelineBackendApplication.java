package com.mergeline.backend;

import com.mergeline.backend.config.MergelineProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.time.Clock;

@SpringBootApplication
@EnableConfigurationProperties({
        MergelineProperties.class
})
public class MergelineBackendApplication {
    public static void main(String[] args) {
        SpringApplication.run(MergelineBackendApplication.class, args);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
