package com.purchasingpower.stocksync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class StockSyncApplication {

    public static void main(String[] args) {
        SpringApplication.run(StockSyncApplication.class, args);
    }
}
