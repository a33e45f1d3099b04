package com.example.gsiprojection;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class GsiProjectionApplication {

    public static void main(String[] args) {
        SpringApplication.run(GsiProjectionApplication.class, args);
    }
}
