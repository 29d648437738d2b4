package com.transmuter;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TransmuterApplication {

    public static void main(String[] args) {
        SpringApplication.run(TransmuterApplication.class, args);
    }
}
