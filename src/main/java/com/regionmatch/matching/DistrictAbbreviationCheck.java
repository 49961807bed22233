package com.regionmatch.matching;

import com.regionmatch.util.names.RegionNames;

/**
 * Lenient district-membership test used when a district was matched through an abbreviation
 * that the strict {@link RegionIndex#validateDistrict(String, String)} test rejects.
 *
 * This is a best-effort heuristic, not a membership test: a candidate is accepted when it is
 * a prefix of one of the city's districts, or when it starts with one of them stripped of its
 * district-type suffix.
 */
public class DistrictAbbreviationCheck {

    private final RegionIndex index;

    public DistrictAbbreviationCheck(RegionIndex index) {
        this.index = index;
    }

    public boolean accepts(String city, String district) {
        for (String known : index.districtsOf(city)) {
            if (known.startsWith(district)) {
                return true;
            }
            if (district.startsWith(RegionNames.stripDistrictSuffixes(known))) {
                return true;
            }
        }
        return false;
    }
}
