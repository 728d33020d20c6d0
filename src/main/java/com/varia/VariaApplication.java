package com.varia;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for Varia - HTTP response cache with Vary and Range aware variant selection.
 */
@SpringBootApplication
public class VariaApplication {

    public static void main(String[] args) {
        SpringApplication.run(VariaApplication.class, args);
    }
}
