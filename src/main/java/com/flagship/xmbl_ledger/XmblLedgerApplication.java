package com.flagship.xmbl_ledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class XmblLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(XmblLedgerApplication.class, args);
    }
}
