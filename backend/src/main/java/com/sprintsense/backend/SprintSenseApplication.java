package com.sprintsense.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SprintSenseApplication {

    public static void main(String[] args) {
        SpringApplication.run(SprintSenseApplication.class, args);
    }
}
