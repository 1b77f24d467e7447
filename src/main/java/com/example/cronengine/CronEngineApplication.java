package com.example.cronengine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = {"com.example.cronengine", "com.example.runner"})
public class CronEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(CronEngineApplication.class, args);
    }
}
