package com.pharmanio;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class PharmanioApplication {

    public static void main(String[] args) {
        SpringApplication.run(PharmanioApplication.class, args);
    }
}
