package com.example.engage;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ProactiveEngagementApplication {

    public static void main(String[] args) {
        SpringApplication.run(ProactiveEngagementApplication.class, args);
    }
}
