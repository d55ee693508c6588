package org.energytrade;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class EnergyTradeApplication {

    public static void main(String[] args) {
        SpringApplication.run(EnergyTradeApplication.class, args);
    }
}
