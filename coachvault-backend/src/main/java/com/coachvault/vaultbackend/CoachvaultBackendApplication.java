package com.coachvault.vaultbackend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CoachvaultBackendApplication {

    public static void main(String[] args) {
        SpringApplication.run(CoachvaultBackendApplication.class, args);
    }
}
