package com.eventradar;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class EventRadarApplication {

    public static void main(String[] args) {
        SpringApplication.run(EventRadarApplication.class, args);
    }
}
