package com.salesanomaly;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SalesAnomalyApplication {

    public static void main(String[] args) {
        SpringApplication.run(SalesAnomalyApplication.class, args);
    }
}
