package com.stockalerts;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class StockAlertsApplication {

    public static void main(String[] args) {
        SpringApplication.run(StockAlertsApplication.class, args);
    }
}
