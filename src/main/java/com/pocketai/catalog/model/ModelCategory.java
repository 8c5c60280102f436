package com.pocketai.catalog.model;

import java.util.Locale;

public enum ModelCategory {
    UTILITY,
    DIAGNOSTIC,
    PERFORMANCE,
    FUN,
    OTHER;

    public String getToken() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ModelCategory fromToken(String token) {
        if (token == null || token.isBlank()) {
            return null;
        }
        return valueOf(token.trim().toUpperCase(Locale.ROOT));
    }
}
