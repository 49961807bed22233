package com.regionmatch.matching;

import com.regionmatch.processing.RegionDataException;
import com.regionmatch.util.names.RegionNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Lookup tables over the gazetteer: province, city and district sets, the province to city
 * and city to district hierarchy, and the reverse city to province and district to owner maps.
 *
 * Built once in a single pass and read-only afterwards. All sets keep gazetteer order.
 */
public class RegionIndex {

    private static final Logger logger = LoggerFactory.getLogger(RegionIndex.class);

    private final Set<String> provinces = new LinkedHashSet<>();
    private final Map<String, Set<String>> provinceCities = new LinkedHashMap<>();
    private final Map<String, String> cityToProvince = new LinkedHashMap<>();
    private final Map<String, Set<String>> cityDistricts = new LinkedHashMap<>();
    private final Map<String, List<Region>> districtToCity = new LinkedHashMap<>();
    private final Set<String> cities = new LinkedHashSet<>();
    private final Set<String> districts = new LinkedHashSet<>();

    private RegionIndex() {
    }

    /**
     * Builds the index.
     *
     * @param regions gazetteer rows; must not be empty
     * @throws RegionDataException if {@code regions} is empty
     */
    public static RegionIndex build(List<Region> regions) {
        if (regions.isEmpty()) {
            throw new RegionDataException("Cannot build a region index from an empty gazetteer");
        }

        RegionIndex index = new RegionIndex();
        for (Region region : regions) {
            index.register(region);
        }

        logger.debug("Indexed {} provinces, {} cities and {} districts ({} district keys incl. abbreviations)",
                index.provinces.size(), index.cities.size(), index.districts.size(), index.districtToCity.size());
        return index;
    }

    private void register(Region region) {
        String province = region.province();
        String city = region.city();

        provinces.add(province);
        provinceCities.computeIfAbsent(province, k -> new LinkedHashSet<>()).add(city);

        cities.add(city);
        cityToProvince.put(city, province);
        if (city.endsWith(RegionNames.CITY_SUFFIX)) {
            String shortName = RegionNames.stripSuffix(city, RegionNames.CITY_SUFFIX);
            if (!shortName.isEmpty()) {
                cityToProvince.put(shortName, province);
            }
        }

        if (!region.hasDistrict()) {
            return;
        }

        String district = region.district();
        Region owner = new Region(province, city);
        districts.add(district);
        cityDistricts.computeIfAbsent(city, k -> new LinkedHashSet<>()).add(district);
        addOwner(district, owner);

        // one abbreviation per suffix the name ends with, e.g. 康定市 -> 康定
        for (String suffix : RegionNames.DISTRICT_SUFFIXES) {
            if (district.endsWith(suffix)) {
                String shortName = RegionNames.stripSuffix(district, suffix);
                if (!shortName.isEmpty()) {
                    addOwner(shortName, owner);
                }
            }
        }
    }

    private void addOwner(String key, Region owner) {
        List<Region> owners = districtToCity.computeIfAbsent(key, k -> new ArrayList<>());
        if (!owners.contains(owner)) {
            owners.add(owner);
        }
    }

    public boolean isMunicipality(String province) {
        return RegionNames.isMunicipality(province);
    }

    public boolean isNoDistrictCity(String city) {
        return RegionNames.isNoDistrictCity(city);
    }

    /**
     * Strict membership: {@code district} is a canonical district of {@code city}.
     */
    public boolean validateDistrict(String city, String district) {
        Set<String> known = cityDistricts.get(city);
        return known != null && known.contains(district);
    }

    /**
     * @param city canonical city name or its abbreviation without 市
     * @return the owning province, or null if unknown
     */
    public String findProvinceByCity(String city) {
        return cityToProvince.get(city);
    }

    /**
     * All (province, city) owners of a district name or abbreviation, in gazetteer order.
     * More than one entry means the name is shared by several cities.
     *
     * @return owners as district-less regions; empty if the name is unknown
     */
    public List<Region> findCitiesByDistrict(String district) {
        List<Region> owners = districtToCity.get(district);
        return owners == null ? List.of() : Collections.unmodifiableList(owners);
    }

    public Set<String> getProvinces() {
        return Collections.unmodifiableSet(provinces);
    }

    public Set<String> getCities() {
        return Collections.unmodifiableSet(cities);
    }

    public Set<String> getDistricts() {
        return Collections.unmodifiableSet(districts);
    }

    public Set<String> citiesOf(String province) {
        Set<String> result = provinceCities.get(province);
        return result == null ? Set.of() : Collections.unmodifiableSet(result);
    }

    public Set<String> districtsOf(String city) {
        Set<String> result = cityDistricts.get(city);
        return result == null ? Set.of() : Collections.unmodifiableSet(result);
    }

    public boolean containsProvince(String province) {
        return provinces.contains(province);
    }

    public boolean containsCity(String city) {
        return cities.contains(city);
    }

    public boolean containsDistrict(String district) {
        return districts.contains(district);
    }
}
