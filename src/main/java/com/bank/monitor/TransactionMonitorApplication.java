package com.bank.monitor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication
@EnableAsync
public class TransactionMonitorApplication {

    public static void main(String[] args) {
        SpringApplication.run(TransactionMonitorApplication.class, args);
    }
}
