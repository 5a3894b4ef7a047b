package com.foodtruck.product.entity;

public enum ProductCategory {
    FOOD,
    DRINK,
    DESSERT,
    SNACK
}
