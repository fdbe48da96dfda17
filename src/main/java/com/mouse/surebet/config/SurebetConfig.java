package com.mouse.surebet.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(SurebetProperties.class)
public class SurebetConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
