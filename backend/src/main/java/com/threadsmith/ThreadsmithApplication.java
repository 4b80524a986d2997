package com.threadsmith;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ThreadsmithApplication {
    public static void main(String[] args) {
        SpringApplication.run(ThreadsmithApplication.class, args);
    }
}
