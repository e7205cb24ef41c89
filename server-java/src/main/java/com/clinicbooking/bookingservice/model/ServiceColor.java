package com.clinicbooking.bookingservice.model;

public enum ServiceColor {
    BLUE,
    GREEN,
    PURPLE,
    RED
}
