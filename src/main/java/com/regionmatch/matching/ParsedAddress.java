package com.regionmatch.matching;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;

/**
 * Result of parsing one address.
 *
 * @param province canonical province-level name, or null if not recognised
 * @param city     canonical city-level name, or null if not recognised
 * @param district canonical district-level name, or null if not recognised
 * @param detail   unconsumed remainder of the input, trimmed; never null
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ParsedAddress(String province, String city, String district, String detail) {

    private static final ParsedAddress EMPTY = new ParsedAddress(null, null, null, "");

    public ParsedAddress {
        detail = detail == null ? "" : detail;
    }

    public static ParsedAddress empty() {
        return EMPTY;
    }

    public boolean hasProvince() {
        return province != null;
    }

    public boolean hasCity() {
        return city != null;
    }

    public boolean hasDistrict() {
        return district != null;
    }

    /**
     * True if province, city and district were all recognised.
     */
    @JsonIgnore
    public boolean isComplete() {
        return province != null && city != null && district != null;
    }

    /**
     * Recognised segments followed by the detail. A municipality's city is not repeated
     * after its identical province name (北京市北京市朝阳区 becomes 北京市朝阳区).
     */
    public String fullAddress() {
        StringBuilder result = new StringBuilder();
        if (province != null) {
            result.append(province);
        }
        if (city != null && !Objects.equals(province, city)) {
            result.append(city);
        }
        if (district != null) {
            result.append(district);
        }
        result.append(detail);
        return result.toString();
    }
}
