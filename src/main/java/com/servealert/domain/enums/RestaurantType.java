package com.servealert.domain.enums;

public enum RestaurantType {
    FAST_CASUAL,
    FINE_DINING,
    CAFE,
    BAR,
    FOOD_TRUCK,
    CATERING
}
