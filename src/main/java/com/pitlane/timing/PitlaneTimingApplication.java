package com.pitlane.timing;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class PitlaneTimingApplication {

    public static void main(String[] args) {
        SpringApplication.run(PitlaneTimingApplication.class, args);
    }
}
