package com.flagship.poker_ledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class PokerLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(PokerLedgerApplication.class, args);
    }
}
