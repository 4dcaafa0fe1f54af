package com.len.stakequeue;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@EnableScheduling
@SpringBootApplication
public class StakeQueueRegistryApplication {

    public static void main(String[] args) {
        SpringApplication.run(StakeQueueRegistryApplication.class, args);
    }

}
