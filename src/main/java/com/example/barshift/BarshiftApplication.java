package com.example.barshift;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BarshiftApplication {

    public static void main(String[] args) {
        SpringApplication.run(BarshiftApplication.class, args);
    }
}
