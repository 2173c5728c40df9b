package com.dadtutor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DadTutorApplication {
    public static void main(String[] args) {
        SpringApplication.run(DadTutorApplication.class, args);
    }
}
