package com.example.clinic;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ClinicBillingApplication {

    public static void main(String[] args) {
        SpringApplication.run(ClinicBillingApplication.class, args);
    }
}
