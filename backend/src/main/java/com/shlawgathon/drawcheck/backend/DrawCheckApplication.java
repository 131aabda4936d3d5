package com.shlawgathon.drawcheck.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DrawCheckApplication {

    public static void main(String[] args) {
        SpringApplication.run(DrawCheckApplication.class, args);
    }
}
