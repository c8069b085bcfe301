package com.example.roledocs;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RoleDocsApplication {

    public static void main(String[] args) {
        SpringApplication.run(RoleDocsApplication.class, args);
    }
}
