package com.xksgroup.signagesync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class SignageSyncApplication {
    public static void main(String[] args) {
        SpringApplication.run(SignageSyncApplication.class, args);
    }
}
