package com.jay.formulaengine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class FormulaEngineApplication {
    public static void main(String[] args) {
        SpringApplication.run(FormulaEngineApplication.class, args);
    }
}
