package com.chainrouter;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ChainRouterApplication {

    public static void main(String[] args) {
        SpringApplication.run(ChainRouterApplication.class, args);
    }
}
