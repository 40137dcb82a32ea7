package com.bridgeai.server;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BridgeServerApplication {

    public static void main(String[] args) {
        SpringApplication.run(BridgeServerApplication.class, args);
    }
}
