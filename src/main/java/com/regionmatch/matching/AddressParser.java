package com.regionmatch.matching;

import com.regionmatch.processing.AddressNormalizer;
import com.regionmatch.processing.ProvinceAliases;
import com.regionmatch.processing.RegionLoader;
import com.regionmatch.util.names.RegionNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Extracts province, city and district from a free-text Chinese address.
 *
 * Three prefix tries (province, city, district), each holding canonical names plus their
 * abbreviations, are matched in sequence against the shrinking remainder of the input. The
 * {@link RegionIndex} validates that the matched levels belong together and infers the levels
 * that the text leaves out.
 *
 * Instances are immutable after construction and can be shared between threads.
 */
public class AddressParser {

    private static final Logger logger = LoggerFactory.getLogger(AddressParser.class);

    private static final int MIN_DISTRICT_ABBREVIATION_LENGTH = 2;

    private final PrefixTrie<String> provinceTrie = new PrefixTrie<>();
    private final PrefixTrie<String> cityTrie = new PrefixTrie<>();
    private final PrefixTrie<String> districtTrie = new PrefixTrie<>();
    private final RegionIndex index;
    private final Map<String, String> provinceAliases;
    private final DistrictAbbreviationCheck abbreviationCheck;
    private final AddressNormalizer normalizer;

    /**
     * Builds a parser over the bundled gazetteer and alias table.
     */
    public AddressParser() {
        this(RegionLoader.load(), ProvinceAliases.load());
    }

    /**
     * Builds a parser over the given gazetteer.
     *
     * @param regions         de-duplicated gazetteer rows, must not be empty
     * @param provinceAliases short province name to canonical province name
     */
    public AddressParser(List<Region> regions, Map<String, String> provinceAliases) {
        Objects.requireNonNull(regions, "regions");
        Objects.requireNonNull(provinceAliases, "provinceAliases");

        this.index = RegionIndex.build(regions);
        this.provinceAliases = Map.copyOf(provinceAliases);
        this.abbreviationCheck = new DistrictAbbreviationCheck(index);
        this.normalizer = new AddressNormalizer(index, this.provinceAliases);

        buildProvinceTrie();
        buildCityTrie();
        buildDistrictTrie();

        logger.info("Address parser ready: {} province keys, {} city keys, {} district keys",
                provinceTrie.size(), cityTrie.size(), districtTrie.size());
    }

    /**
     * The shared parser over the bundled data, built on first use.
     */
    public static AddressParser global() {
        return GlobalHolder.INSTANCE;
    }

    private static class GlobalHolder {
        private static final AddressParser INSTANCE = new AddressParser();
    }

    // Canonical names go in first; an abbreviation only claims a key that is still free.

    private void buildProvinceTrie() {
        for (String province : index.getProvinces()) {
            provinceTrie.insert(province, province);
        }
        for (Map.Entry<String, String> alias : provinceAliases.entrySet()) {
            if (index.containsProvince(alias.getValue()) && !provinceTrie.contains(alias.getKey())) {
                provinceTrie.insert(alias.getKey(), alias.getValue());
            }
        }
    }

    private void buildCityTrie() {
        for (String city : index.getCities()) {
            cityTrie.insert(city, city);
        }
        for (String city : index.getCities()) {
            if (city.endsWith(RegionNames.CITY_SUFFIX)) {
                String shortName = RegionNames.stripSuffix(city, RegionNames.CITY_SUFFIX);
                if (!shortName.isEmpty() && !cityTrie.contains(shortName)) {
                    cityTrie.insert(shortName, city);
                }
            }
        }
    }

    private void buildDistrictTrie() {
        for (String district : index.getDistricts()) {
            districtTrie.insert(district, district);
        }
        for (String district : index.getDistricts()) {
            for (String suffix : RegionNames.DISTRICT_SUFFIXES) {
                if (!district.endsWith(suffix)) {
                    continue;
                }
                String shortName = RegionNames.stripSuffix(district, suffix);
                // single characters collide with too many ordinary words
                if (shortName.codePointCount(0, shortName.length()) >= MIN_DISTRICT_ABBREVIATION_LENGTH
                        && !districtTrie.contains(shortName)) {
                    districtTrie.insert(shortName, district);
                }
            }
        }
    }

    /**
     * Parses an address.
     *
     * Never throws: unrecognised text ends up in {@link ParsedAddress#detail()} and ambiguous
     * levels are left null rather than guessed. The detail is trimmed on both ends, so blanks
     * between the last recognised segment and the remaining text are dropped.
     *
     * @param address free text, may be null
     */
    public ParsedAddress parse(String address) {
        if (address == null || address.isBlank()) {
            return ParsedAddress.empty();
        }

        ParseState state = new ParseState(address.strip());

        if (matchProvince(state)) {
            return state.toResult();
        }
        matchCityOrDistrict(state);
        if (state.district == null) {
            completeDistrict(state);
        }

        if (state.province != null && state.city == null && index.isMunicipality(state.province)) {
            state.city = state.province;
        }
        return state.toResult();
    }

    /**
     * Province stage.
     *
     * @return true if a municipality was matched; its district has then been resolved as well
     *         and parsing is complete
     */
    private boolean matchProvince(ParseState state) {
        PrefixTrie.Match<String> provinceMatch = provinceTrie.findLongestPrefix(state.remaining);
        if (provinceMatch == null) {
            return false;
        }

        state.province = provinceMatch.value();
        state.consume(provinceMatch);

        if (!index.isMunicipality(state.province)) {
            return false;
        }

        state.city = state.province;
        PrefixTrie.Match<String> districtMatch = districtTrie.findLongestPrefix(state.remaining);
        if (districtMatch != null && index.validateDistrict(state.province, districtMatch.value())) {
            state.district = districtMatch.value();
            state.consume(districtMatch);
        }
        return true;
    }

    /**
     * City-or-district stage. Without province context a district reading wins when it is
     * longer than the city reading, carries a full district suffix, or is the only reading.
     */
    private void matchCityOrDistrict(ParseState state) {
        PrefixTrie.Match<String> cityMatch = cityTrie.findLongestPrefix(state.remaining);
        PrefixTrie.Match<String> districtMatch = districtTrie.findLongestPrefix(state.remaining);

        if (preferDistrict(state, cityMatch, districtMatch)) {
            state.district = districtMatch.value();
            state.consume(districtMatch);

            List<Region> owners = index.findCitiesByDistrict(state.district);
            if (owners.size() == 1) {
                state.province = owners.get(0).province();
                state.city = owners.get(0).city();
            } else if (owners.size() > 1) {
                logger.debug("District {} is shared by {} cities, leaving city unresolved", state.district, owners.size());
            }
            return;
        }

        if (cityMatch == null) {
            return;
        }

        String city = cityMatch.value();
        String cityProvince = index.findProvinceByCity(city);
        if (state.province != null && !state.province.equals(cityProvince)) {
            logger.debug("Ignoring city {} of {} inside {}", city, cityProvince, state.province);
            return;
        }

        state.city = city;
        if (state.province == null) {
            state.province = cityProvince;
        }
        state.consume(cityMatch);
    }

    private boolean preferDistrict(ParseState state, PrefixTrie.Match<String> cityMatch,
                                   PrefixTrie.Match<String> districtMatch) {
        if (state.province != null || districtMatch == null) {
            return false;
        }
        if (cityMatch == null) {
            return true;
        }
        return districtMatch.length() > cityMatch.length()
                || RegionNames.hasQualifiedDistrictSuffix(districtMatch.value());
    }

    /**
     * District completion stage, reached when the previous stage did not settle the district.
     */
    private void completeDistrict(ParseState state) {
        PrefixTrie.Match<String> districtMatch = districtTrie.findLongestPrefix(state.remaining);
        if (districtMatch == null) {
            return;
        }

        String district = districtMatch.value();
        if (state.city != null
                && !index.validateDistrict(state.city, district)
                && !abbreviationCheck.accepts(state.city, district)) {
            return;
        }

        state.district = district;
        state.consume(districtMatch);

        if (state.city == null) {
            List<Region> owners = index.findCitiesByDistrict(district);
            if (owners.size() == 1) {
                state.province = owners.get(0).province();
                state.city = owners.get(0).city();
            } else if (state.province != null) {
                String province = state.province;
                owners.stream()
                        .filter(owner -> owner.province().equals(province))
                        .findFirst()
                        .ifPresent(owner -> state.city = owner.city());
            }
        }

        if (state.province == null && state.city != null) {
            state.province = index.findProvinceByCity(state.city);
        }
    }

    /**
     * Parses every address independently; the result list has the order of the input.
     */
    public List<ParsedAddress> parseBatch(List<String> addresses) {
        return addresses.parallelStream()
                .map(this::parse)
                .collect(Collectors.toList());
    }

    /**
     * Canonical concatenation of possibly abbreviated names, see {@link AddressNormalizer}.
     *
     * Null names contribute nothing.
     */
    public String normalize(String province, String city, String district) {
        return normalizer.normalize(province, city, district);
    }

    /**
     * True if at least the province or the city of the address can be recognised.
     */
    public boolean isValidAddress(String address) {
        ParsedAddress result = parse(address);
        return result.hasProvince() || result.hasCity();
    }

    public Set<String> provinces() {
        return index.getProvinces();
    }

    /**
     * @param province canonical or abbreviated province name
     * @return the province's cities, empty if the province is unknown or null
     */
    public Set<String> citiesOfProvince(String province) {
        return index.citiesOf(normalizer.resolveProvince(province));
    }

    /**
     * @param city canonical city name or its abbreviation without 市
     * @return the city's districts, empty for unknown or null cities and cities without districts
     */
    public Set<String> districtsOfCity(String city) {
        return index.districtsOf(normalizer.resolveCity(city));
    }

    public RegionIndex getIndex() {
        return index;
    }

    /**
     * Mutable per-call state; never escapes {@link #parse(String)}.
     */
    private static class ParseState {
        private String remaining;
        private String province;
        private String city;
        private String district;

        ParseState(String text) {
            this.remaining = text;
        }

        void consume(PrefixTrie.Match<String> match) {
            remaining = remaining.substring(match.length());
        }

        ParsedAddress toResult() {
            return new ParsedAddress(province, city, district, remaining.strip());
        }
    }
}
