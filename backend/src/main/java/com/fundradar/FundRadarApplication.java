package com.fundradar;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FundRadarApplication {

    public static void main(String[] args) {
        SpringApplication.run(FundRadarApplication.class, args);
    }
}
