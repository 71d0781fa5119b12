package com.rangerewards;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RangeRewardsApplication {

    public static void main(String[] args) {
        SpringApplication.run(RangeRewardsApplication.class, args);
    }
}
