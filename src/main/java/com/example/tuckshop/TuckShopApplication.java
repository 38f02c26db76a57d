package com.example.tuckshop;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Main application class for the tuck shop order service.
 */
@SpringBootApplication
@EnableScheduling
public class TuckShopApplication {

    public static void main(String[] args) {
        SpringApplication.run(TuckShopApplication.class, args);
    }
}
