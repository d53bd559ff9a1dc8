package com.tradecontrol;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class TradeControlApplication {

    public static void main(String[] args) {
        SpringApplication.run(TradeControlApplication.class, args);
    }
}
