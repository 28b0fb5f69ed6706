package com.nutritioninsights.dietanalysis;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DietAnalysisApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(DietAnalysisApplication.class, args)));
    }

}
