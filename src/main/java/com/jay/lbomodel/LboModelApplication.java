package com.jay.lbomodel;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LboModelApplication {
    public static void main(String[] args) {
        SpringApplication.run(LboModelApplication.class, args);
    }
}
