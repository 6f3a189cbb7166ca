package com.kreasipositif.bankregistry;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BankRegistryApplication {

    public static void main(String[] args) {
        SpringApplication.run(BankRegistryApplication.class, args);
    }
}
