package com.eainde.specmap.model;

import java.util.Locale;

/**
 * Physical quantity a unit belongs to. Used to keep template slots with an expected unit
 * from receiving values of a different kind.
 */
public enum UnitFamily {
    LUMINANCE,
    LENGTH,
    PERCENTAGE,
    RATIO,
    TEMPERATURE,
    PRESSURE,
    HARDNESS,
    ANGLE,
    TIME,
    FREQUENCY,
    VOLTAGE,
    CURRENT,
    POWER,
    FORCE,
    RESOLUTION,
    DIMENSIONLESS,
    UNKNOWN;

    /**
     * Classifies a unit string. Blank units are dimensionless, unrecognised ones {@link #UNKNOWN}.
     */
    public static UnitFamily classify(String unit) {
        if (unit == null || unit.isBlank()) {
            return DIMENSIONLESS;
        }
        String u = unit.strip().toLowerCase(Locale.ROOT)
                .replace("²", "2")
                .replace("^2", "2")
                .replace(" ", "");

        if (u.equals("cd/m2") || u.equals("nit") || u.equals("nits")) return LUMINANCE;
        if (u.equals("%")) return PERCENTAGE;
        if (u.equals(":1") || u.equals("ratio")) return RATIO;
        if (u.equals("°c") || u.equals("c") || u.equals("°f") || u.equals("k")) return TEMPERATURE;
        if (u.equals("mpa") || u.equals("gpa") || u.equals("kpa") || u.equals("pa")) return PRESSURE;
        if (u.equals("ms") || u.equals("s") || u.equals("µs") || u.equals("us") || u.equals("min")
                || u.equals("h") || u.equals("hr") || u.equals("hrs") || u.equals("hours")) return TIME;
        // pencil hardness always carries a grade digit ("9H"); a bare "h" is hours
        if (u.matches("\\d+h") || u.equals("hv") || u.equals("mohs") || u.equals("pencil")) return HARDNESS;
        if (u.equals("°") || u.equals("deg") || u.equals("degree") || u.equals("degrees")) return ANGLE;
        if (u.equals("hz") || u.equals("khz") || u.equals("mhz")) return FREQUENCY;
        if (u.equals("v") || u.equals("mv")) return VOLTAGE;
        if (u.equals("a") || u.equals("ma")) return CURRENT;
        if (u.equals("w") || u.equals("mw")) return POWER;
        if (u.equals("n") || u.equals("kgf") || u.equals("gf")) return FORCE;
        if (u.equals("ppi") || u.equals("dpi") || u.equals("px") || u.equals("pixels")) return RESOLUTION;
        if (u.equals("mm") || u.equals("µm") || u.equals("um") || u.equals("nm")
                || u.equals("cm") || u.equals("m") || u.equals("inch") || u.equals("\"")) return LENGTH;
        return UNKNOWN;
    }

    /**
     * Two families are compatible unless both are known and differ.
     */
    public boolean isCompatibleWith(UnitFamily other) {
        if (this == UNKNOWN || other == null || other == UNKNOWN) {
            return true;
        }
        return this == other;
    }
}
