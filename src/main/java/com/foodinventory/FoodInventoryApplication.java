package com.foodinventory;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FoodInventoryApplication {

    public static void main(String[] args) {
        SpringApplication.run(FoodInventoryApplication.class, args);
    }
}
