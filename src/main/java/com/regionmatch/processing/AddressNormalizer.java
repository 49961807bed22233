package com.regionmatch.processing;

import com.regionmatch.matching.RegionIndex;
import com.regionmatch.util.names.RegionNames;

import java.util.Map;

/**
 * Expands abbreviated province, city and district names to their canonical form.
 * Names that cannot be resolved are passed through unchanged; a null name resolves to null.
 */
public class AddressNormalizer {

    private final RegionIndex index;
    private final Map<String, String> provinceAliases;

    public AddressNormalizer(RegionIndex index, Map<String, String> provinceAliases) {
        this.index = index;
        this.provinceAliases = provinceAliases;
    }

    /**
     * Concatenates the canonical forms of the given names without separator.
     *
     * A municipality is not de-duplicated: ("北京", "北京", "朝阳") gives 北京市北京市朝阳区.
     * A null name contributes nothing.
     */
    public String normalize(String province, String city, String district) {
        StringBuilder result = new StringBuilder();
        if (province != null) {
            result.append(resolveProvince(province));
        }
        if (city != null) {
            result.append(resolveCity(city));
        }
        if (district != null) {
            result.append(resolveDistrict(district));
        }
        return result.toString();
    }

    /**
     * Alias table first, then the canonical set, then the name with 省 appended.
     */
    public String resolveProvince(String province) {
        if (province == null) {
            return null;
        }
        String canonical = provinceAliases.get(province);
        if (canonical != null) {
            return canonical;
        }
        if (index.containsProvince(province)) {
            return province;
        }

        String withSuffix = province + RegionNames.PROVINCE_SUFFIX;
        return index.containsProvince(withSuffix) ? withSuffix : province;
    }

    public String resolveCity(String city) {
        if (city == null) {
            return null;
        }
        if (index.containsCity(city)) {
            return city;
        }

        String withSuffix = city + RegionNames.CITY_SUFFIX;
        return index.containsCity(withSuffix) ? withSuffix : city;
    }

    /**
     * Canonical set first, then 区, 县 and 市 appended in that order.
     */
    public String resolveDistrict(String district) {
        if (district == null) {
            return null;
        }
        if (index.containsDistrict(district)) {
            return district;
        }

        for (String suffix : RegionNames.DISTRICT_COMPLETION_SUFFIXES) {
            String withSuffix = district + suffix;
            if (index.containsDistrict(withSuffix)) {
                return withSuffix;
            }
        }
        return district;
    }
}
