package com.sheetcalc.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class SheetCalcApplication {

    public static void main(String[] args) {
        SpringApplication.run(SheetCalcApplication.class, args);
    }
}
