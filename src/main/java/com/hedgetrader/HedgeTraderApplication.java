package com.hedgetrader;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class HedgeTraderApplication {

    public static void main(String[] args) {
        SpringApplication.run(HedgeTraderApplication.class, args);
    }
}
