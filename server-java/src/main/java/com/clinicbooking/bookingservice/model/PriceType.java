package com.clinicbooking.bookingservice.model;

public enum PriceType {
    FIXED,
    VARIABLE
}
