package com.cleanbear.assignment;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TechnicianAssignmentApplication {

    public static void main(String[] args) {
        SpringApplication.run(TechnicianAssignmentApplication.class, args);
    }
}
