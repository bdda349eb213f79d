package com.star.loginsight;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LogInsightApplication {

    public static void main(String[] args) {
        SpringApplication.run(LogInsightApplication.class, args);
    }
}
