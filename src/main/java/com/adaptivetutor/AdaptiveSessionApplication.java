package com.adaptivetutor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class AdaptiveSessionApplication {

    public static void main(String[] args) {
        SpringApplication.run(AdaptiveSessionApplication.class, args);
    }
}
