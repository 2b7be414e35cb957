package com.itdesk.backend.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class AppConfig {

    // Relógio injetável: prazos de SLA e carimbos de data saem daqui
    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }
}
