package com.example.smartroll;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SmartrollApplication {

    public static void main(String[] args) {
        SpringApplication.run(SmartrollApplication.class, args);
    }
}
