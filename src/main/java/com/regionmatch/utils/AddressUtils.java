package com.regionmatch.utils;

import com.regionmatch.matching.AddressParser;
import com.regionmatch.matching.ParsedAddress;

import java.util.List;

/**
 * Static shortcuts over the shared {@link AddressParser#global()} instance.
 * The first call pays for loading the bundled gazetteer.
 */
public class AddressUtils {

    /**
     * Splits an address into province, city, district and detail.
     *
     * <pre>
     * AddressUtils.parse("北京市朝阳区望京")  // 北京市 / 北京市 / 朝阳区 / 望京
     * </pre>
     */
    public static ParsedAddress parse(String address) {
        return AddressParser.global().parse(address);
    }

    public static List<ParsedAddress> parseBatch(List<String> addresses) {
        return AddressParser.global().parseBatch(addresses);
    }

    /**
     * Canonical concatenation of possibly abbreviated names.
     *
     * <pre>
     * AddressUtils.normalize("广东", "深圳", "南山")  // 广东省深圳市南山区
     * </pre>
     *
     * @param district optional, may be null
     */
    public static String normalize(String province, String city, String district) {
        return AddressParser.global().normalize(province, city, district);
    }

    public static boolean isValidAddress(String address) {
        return AddressParser.global().isValidAddress(address);
    }
}
