package com.eainde.extraction;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LeaseExtractionApplication {

    public static void main(String[] args) {
        SpringApplication.run(LeaseExtractionApplication.class, args);
    }
}
