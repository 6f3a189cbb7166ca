package com.kreasipositif.bankgateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BankGatewaySandboxApplication {

    public static void main(String[] args) {
        SpringApplication.run(BankGatewaySandboxApplication.class, args);
    }
}
