package com.lawnsim;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class LawnSimApplication {
    public static void main(String[] args) {
        SpringApplication.run(LawnSimApplication.class, args);
    }
}
