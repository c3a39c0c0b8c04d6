package com.flagship.mining_ledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@ConfigurationPropertiesScan
@EnableScheduling
public class MiningLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(MiningLedgerApplication.class, args);
    }
}
