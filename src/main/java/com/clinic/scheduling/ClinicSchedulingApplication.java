package com.clinic.scheduling;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ClinicSchedulingApplication {

    public static void main(String[] args) {
        SpringApplication.run(ClinicSchedulingApplication.class, args);
    }
}
