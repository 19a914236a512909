package com.mouse.apex;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class ApexOddsEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(ApexOddsEngineApplication.class, args);
    }
}
