package com.project.lingodeck.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LingoDeckApplication {

    public static void main(String[] args) {
        SpringApplication.run(LingoDeckApplication.class, args);
    }
}
