package com.tracelens.dashboard;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TraceLensDashboardApplication {

    public static void main(String[] args) {
        SpringApplication.run(TraceLensDashboardApplication.class, args);
    }
}
