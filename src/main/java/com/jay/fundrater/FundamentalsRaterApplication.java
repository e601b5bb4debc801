package com.jay.fundrater;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FundamentalsRaterApplication {
    public static void main(String[] args) {
        SpringApplication.run(FundamentalsRaterApplication.class, args);
    }
}
