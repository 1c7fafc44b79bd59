package com.example.revisiondiff;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RevisionDiffApplication {
    public static void main(String[] args) {
        SpringApplication.run(RevisionDiffApplication.class, args);
    }
}
