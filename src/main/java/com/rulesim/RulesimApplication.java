package com.rulesim;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RulesimApplication {

    public static void main(String[] args) {
        SpringApplication.run(RulesimApplication.class, args);
    }
}
