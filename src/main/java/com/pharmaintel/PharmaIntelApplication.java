package com.pharmaintel;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PharmaIntelApplication {

    public static void main(String[] args) {
        SpringApplication.run(PharmaIntelApplication.class, args);
    }
}
