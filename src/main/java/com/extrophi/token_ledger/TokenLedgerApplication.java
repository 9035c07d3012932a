package com.extrophi.token_ledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class TokenLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(TokenLedgerApplication.class, args);
    }
}
