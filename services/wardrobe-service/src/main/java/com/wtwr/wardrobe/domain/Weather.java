package com.wtwr.wardrobe.domain;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/** Weather a clothing item is suited for. Serialized in lower case. */
public enum Weather {
    HOT,
    WARM,
    COLD;

    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static List<String> wireValues() {
        return Arrays.stream(values()).map(Weather::wireValue).toList();
    }

    public static Optional<Weather> fromWire(String value) {
        return Arrays.stream(values()).filter(w -> w.wireValue().equals(value)).findFirst();
    }
}
