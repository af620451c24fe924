package com.vaultrebalancer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class VaultRebalancerApplication {

    public static void main(String[] args) {
        SpringApplication.run(VaultRebalancerApplication.class, args);
    }
}
