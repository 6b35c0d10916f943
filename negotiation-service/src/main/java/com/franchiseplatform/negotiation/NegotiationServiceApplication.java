package com.franchiseplatform.negotiation;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class NegotiationServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(NegotiationServiceApplication.class, args);
    }
}
