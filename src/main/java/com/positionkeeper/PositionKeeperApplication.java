package com.positionkeeper;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class PositionKeeperApplication {

    public static void main(String[] args) {
        SpringApplication.run(PositionKeeperApplication.class, args);
    }
}
