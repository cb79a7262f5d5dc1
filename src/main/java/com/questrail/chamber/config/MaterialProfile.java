package com.questrail.chamber.config;

import java.util.Objects;

/**
 * Chamber settings applied when a print of the given material is detected.
 *
 * @param material    filament type, upper case (e.g. "ABS")
 * @param setpoint    chamber temperature; zero means the material is printed unheated
 * @param fansEnabled run the filtration fans
 */
public record MaterialProfile(String material, double setpoint, boolean fansEnabled)
{
    public MaterialProfile {
        Objects.requireNonNull(material, "material");
        if (material.isBlank()) {
            throw new IllegalArgumentException("material must not be blank");
        }
        if (!Double.isFinite(setpoint) || setpoint < 0) {
            throw new IllegalArgumentException("setpoint must be a non-negative number");
        }
    }

    public boolean heats() {
        return setpoint > 0;
    }
}
