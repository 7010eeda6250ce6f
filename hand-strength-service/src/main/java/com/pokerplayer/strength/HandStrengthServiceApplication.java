package com.pokerplayer.strength;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class HandStrengthServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(HandStrengthServiceApplication.class, args);
    }
}
