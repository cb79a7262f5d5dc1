package com.questrail.chamber.config;

import java.util.Collection;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Lookup of {@link MaterialProfile}s by filament type, case-insensitive.
 */
public final class MaterialProfiles
{
    private final Map<String, MaterialProfile> profiles;

    private MaterialProfiles(Map<String, MaterialProfile> profiles) {
        this.profiles = Map.copyOf(profiles);
    }

    /**
     * Profiles for the common enclosure materials.
     */
    public static MaterialProfiles defaults() {
        return builder()
                .add(new MaterialProfile("PC", 60, false))
                .add(new MaterialProfile("ABS", 60, true))
                .add(new MaterialProfile("ASA", 65, true))
                .add(new MaterialProfile("PETG", 40, true))
                .add(new MaterialProfile("PLA", 0, false))
                .add(new MaterialProfile("HIPS", 60, true))
                .add(new MaterialProfile("TPU", 40, false))
                .add(new MaterialProfile("NYLON", 60, false))
                .build();
    }

    public static MaterialProfiles empty() {
        return new MaterialProfiles(Map.of());
    }

    public Optional<MaterialProfile> lookup(String material) {
        if (material == null || material.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(profiles.get(normalize(material)));
    }

    public Collection<MaterialProfile> all() {
        return profiles.values();
    }

    private static String normalize(String material) {
        return material.trim().toUpperCase(Locale.ROOT);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final Map<String, MaterialProfile> profiles = new HashMap<>();

        private Builder() {}

        public Builder add(MaterialProfile profile) {
            Objects.requireNonNull(profile, "profile");
            profiles.put(normalize(profile.material()), profile);
            return this;
        }

        public MaterialProfiles build() {
            return new MaterialProfiles(profiles);
        }
    }
}
