package com.copytraderadar;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CopyTradeRadarApplication {

    public static void main(String[] args) {
        SpringApplication.run(CopyTradeRadarApplication.class, args);
    }
}
