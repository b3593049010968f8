package org.trump304.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.security.SecureRandom;
import java.util.Random;

@Configuration
public class EngineConfig {

    /** Shuffles, dealer draw and timeout auto-play. */
    @Bean
    public Random gameRandom() {
        return new SecureRandom();
    }
}
