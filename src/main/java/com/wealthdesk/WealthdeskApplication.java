package com.wealthdesk;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class WealthdeskApplication {

    public static void main(String[] args) {
        SpringApplication.run(WealthdeskApplication.class, args);
    }
}
