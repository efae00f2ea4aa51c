package com.example.messenger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class MessengerDispatchApplication {

    public static void main(String[] args) {
        SpringApplication.run(MessengerDispatchApplication.class, args);
    }
}
