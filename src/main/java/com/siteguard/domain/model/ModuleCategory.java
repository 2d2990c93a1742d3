package com.siteguard.domain.model;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

public enum ModuleCategory {
    CORE,
    CONTRIB,
    CUSTOM;

    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<ModuleCategory> fromWireValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        return Arrays.stream(values())
            .filter(category -> category.name().equals(normalized))
            .findFirst();
    }
}
