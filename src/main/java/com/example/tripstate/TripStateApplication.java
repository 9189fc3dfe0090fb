package com.example.tripstate;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class TripStateApplication {

    public static void main(String[] args) {
        SpringApplication.run(TripStateApplication.class, args);
    }
}
