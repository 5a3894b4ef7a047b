package com.foodtruck;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.core.Ordered;

/**
 * Cache advice is ordered ahead of the transaction advice, so an eviction runs
 * after the surrounding transaction has committed.
 */
@SpringBootApplication
@EnableCaching(order = Ordered.LOWEST_PRECEDENCE - 1)
public class FoodTruckApplication {

    public static void main(String[] args) {
        SpringApplication.run(FoodTruckApplication.class, args);
    }
}
