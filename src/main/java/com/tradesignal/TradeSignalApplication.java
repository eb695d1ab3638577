package com.tradesignal;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan({"com.tradesignal.shared.config"})
public class TradeSignalApplication {

    public static void main(String[] args) {
        SpringApplication.run(TradeSignalApplication.class, args);
    }
}
