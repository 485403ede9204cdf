package com.bank.lending;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LoanDecisionApplication {

    public static void main(String[] args) {
        SpringApplication.run(LoanDecisionApplication.class, args);
    }
}
