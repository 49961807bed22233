package com.regionmatch.matching;

import java.util.Objects;

/**
 * One gazetteer row.
 *
 * @param province canonical province-level name, never empty
 * @param city     canonical city-level name, never empty
 * @param district canonical district-level name, or null for a city without districts
 */
public record Region(String province, String city, String district) {

    public Region {
        Objects.requireNonNull(province, "province");
        Objects.requireNonNull(city, "city");
        if (province.isEmpty() || city.isEmpty()) {
            throw new IllegalArgumentException("province and city must not be empty");
        }
    }

    public Region(String province, String city) {
        this(province, city, null);
    }

    public boolean hasDistrict() {
        return district != null;
    }

    /**
     * Province, city and district (when present) concatenated without separator.
     */
    public String fullName() {
        return district == null ? province + city : province + city + district;
    }
}
