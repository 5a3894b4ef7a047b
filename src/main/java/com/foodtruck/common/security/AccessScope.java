package com.foodtruck.common.security;

/**
 * How far a granted action reaches. {@code ANY} includes everything {@code OWN} covers.
 */
public enum AccessScope {
    OWN,
    ANY
}
