package com.example.realtime;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
public class RealtimeDeliveryApplication {

    public static void main(String[] args) {
        SpringApplication.run(RealtimeDeliveryApplication.class, args);
    }
}
