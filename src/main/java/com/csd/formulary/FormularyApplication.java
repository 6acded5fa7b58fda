package com.csd.formulary;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FormularyApplication {
    public static void main(String[] args) {
        SpringApplication.run(FormularyApplication.class, args);
    }
}
