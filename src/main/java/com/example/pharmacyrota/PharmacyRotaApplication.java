package com.example.pharmacyrota;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PharmacyRotaApplication {

    public static void main(String[] args) {
        SpringApplication.run(PharmacyRotaApplication.class, args);
    }
}
