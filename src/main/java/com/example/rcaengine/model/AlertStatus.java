package com.example.rcaengine.model;

import java.util.Locale;

public enum AlertStatus {
    FIRING, RESOLVED;

    public static AlertStatus parse(String value) {
        if (value == null || value.isBlank()) return FIRING;
        return "resolved".equals(value.trim().toLowerCase(Locale.ROOT)) ? RESOLVED : FIRING;
    }
}
