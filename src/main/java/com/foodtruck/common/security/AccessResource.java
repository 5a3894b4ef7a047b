package com.foodtruck.common.security;

public enum AccessResource {
    PRODUCT,
    USER,
    ORDER
}
