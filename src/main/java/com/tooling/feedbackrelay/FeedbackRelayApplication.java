package com.tooling.feedbackrelay;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class FeedbackRelayApplication {

    public static void main(String[] args) {
        SpringApplication.run(FeedbackRelayApplication.class, args);
    }
}
