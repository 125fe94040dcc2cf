package com.verticx.finance;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class VerticxFinanceApplication {
    public static void main(String[] args) {
        SpringApplication.run(VerticxFinanceApplication.class, args);
    }
}
