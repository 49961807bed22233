package com.regionmatch.util.names;

import java.util.List;
import java.util.Set;

/**
 * Administrative suffixes and the fixed name sets of the Chinese gazetteer.
 */
public class RegionNames {

    public static final String PROVINCE_SUFFIX = "省";
    public static final String CITY_SUFFIX = "市";

    /**
     * Suffixes stripped from district names to build their abbreviations, in this order.
     */
    public static final List<String> DISTRICT_SUFFIXES = List.of("区", "县", "市", "旗");

    /**
     * Suffixes tried, in this order, when completing an abbreviated district name.
     */
    public static final List<String> DISTRICT_COMPLETION_SUFFIXES = List.of("区", "县", "市");

    /**
     * A district ending in one of these is unambiguously a district, never a city abbreviation.
     */
    public static final List<String> QUALIFIED_DISTRICT_SUFFIXES = List.of("区", "县", "旗");

    private static final List<String> CITY_LEVEL_SUFFIXES = List.of("市", "自治州", "地区", "盟");

    public static final Set<String> MUNICIPALITIES = Set.of("北京市", "上海市", "天津市", "重庆市");

    /**
     * Prefecture-level cities with no district subdivision.
     */
    public static final Set<String> NO_DISTRICT_CITIES = Set.of("东莞市", "中山市", "儋州市", "嘉峪关市");

    public static boolean isMunicipality(String province) {
        return province != null && MUNICIPALITIES.contains(province);
    }

    public static boolean isNoDistrictCity(String city) {
        return city != null && NO_DISTRICT_CITIES.contains(city);
    }

    /**
     * Removes every trailing occurrence of {@code suffix} from {@code name}.
     *
     * @return the stripped name, possibly empty; the name itself if it does not end with the suffix
     */
    public static String stripSuffix(String name, String suffix) {
        String result = name;
        while (!suffix.isEmpty() && result.endsWith(suffix)) {
            result = result.substring(0, result.length() - suffix.length());
        }
        return result;
    }

    /**
     * Removes trailing district-type characters (区, 县, 市, 旗) in any combination.
     */
    public static String stripDistrictSuffixes(String name) {
        String result = name;
        boolean stripped = true;
        while (stripped && !result.isEmpty()) {
            stripped = false;
            for (String suffix : DISTRICT_SUFFIXES) {
                if (result.endsWith(suffix)) {
                    result = result.substring(0, result.length() - suffix.length());
                    stripped = true;
                }
            }
        }
        return result;
    }

    public static boolean hasQualifiedDistrictSuffix(String district) {
        return QUALIFIED_DISTRICT_SUFFIXES.stream().anyMatch(district::endsWith);
    }

    /**
     * Appends the city suffix unless the name already carries a city-level suffix
     * (市, 自治州, 地区, 盟).
     */
    public static String normalizeCityName(String city) {
        if (CITY_LEVEL_SUFFIXES.stream().anyMatch(city::endsWith)) {
            return city;
        }
        return city + CITY_SUFFIX;
    }

    /**
     * Appends 区 unless the name already ends with a district-type suffix.
     */
    public static String normalizeDistrictName(String district) {
        if (DISTRICT_SUFFIXES.stream().anyMatch(district::endsWith)) {
            return district;
        }
        return district + "区";
    }
}
