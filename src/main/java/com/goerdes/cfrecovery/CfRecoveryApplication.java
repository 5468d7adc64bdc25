package com.goerdes.cfrecovery;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CfRecoveryApplication {

    public static void main(String[] args) {
        SpringApplication.run(CfRecoveryApplication.class, args);
    }

}
