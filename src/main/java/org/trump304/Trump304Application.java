package org.trump304;

import org.trump304.config.GameRulesProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties(GameRulesProperties.class)
public class Trump304Application {
    public static void main(String[] args) {
        SpringApplication.run(Trump304Application.class, args);
    }
}
