package com.regionmatch.matching;

import static org.assertj.core.api.Assertions.*;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

class AddressParserTest {

    private static AddressParser parser;

    @BeforeAll
    static void createParser() {
        parser = new AddressParser();
    }

    private static void assertParsed(ParsedAddress result, String province, String city, String district, String detail) {
        assertThat(result.province()).as("province").isEqualTo(province);
        assertThat(result.city()).as("city").isEqualTo(city);
        assertThat(result.district()).as("district").isEqualTo(district);
        assertThat(result.detail()).as("detail").isEqualTo(detail);
    }

    @Test
    void testFullAddress() {
        assertParsed(parser.parse("广东省深圳市南山区科技园路1号"), "广东省", "深圳市", "南山区", "科技园路1号");
    }

    @Test
    void testAbbreviatedCityAndDistrict() {
        assertParsed(parser.parse("深圳南山科技园"), "广东省", "深圳市", "南山区", "科技园");
    }

    @Test
    void testAmbiguousDistrictWithoutContext() {
        // 南山区 exists in 深圳 and 鹤岗
        assertParsed(parser.parse("南山区科技园"), null, null, "南山区", "科技园");
        assertParsed(parser.parse("朝阳区"), null, null, "朝阳区", "");
    }

    @Test
    void testProvinceNarrowsSharedDistrict() {
        assertParsed(parser.parse("广东省南山区"), "广东省", "深圳市", "南山区", "");
        assertParsed(parser.parse("吉林省长春市朝阳区"), "吉林省", "长春市", "朝阳区", "");
    }

    @Test
    void testUniqueDistrictInfersCityAndProvince() {
        assertParsed(parser.parse("福田区"), "广东省", "深圳市", "福田区", "");
        assertParsed(parser.parse("宝安区"), "广东省", "深圳市", "宝安区", "");
    }

    @Test
    void testMunicipality() {
        assertParsed(parser.parse("北京朝阳"), "北京市", "北京市", "朝阳区", "");
        assertParsed(parser.parse("北京朝阳区"), "北京市", "北京市", "朝阳区", "");
    }

    @Test
    void testMunicipalityRejectsForeignDistrict() {
        assertParsed(parser.parse("北京市南山区"), "北京市", "北京市", null, "南山区");
    }

    @Test
    void testMunicipalityDoesNotMatchRepeatedCity() {
        assertParsed(parser.parse("北京市北京市朝阳区"), "北京市", "北京市", null, "北京市朝阳区");
    }

    @Test
    void testAutonomousPrefecture() {
        assertParsed(parser.parse("云南大理"), "云南省", "大理白族自治州", "大理市", "");
        assertParsed(parser.parse("四川甘孜"), "四川省", "甘孜藏族自治州", "甘孜县", "");
    }

    @Test
    void testCountyLevelCityAlone() {
        assertParsed(parser.parse("康定市"), "四川省", "甘孜藏族自治州", "康定市", "");
        assertParsed(parser.parse("大理市"), "云南省", "大理白族自治州", "大理市", "");
        assertParsed(parser.parse("义乌市"), "浙江省", "金华市", "义乌市", "");
        assertParsed(parser.parse("昆山市"), "江苏省", "苏州市", "昆山市", "");
        assertParsed(parser.parse("寿光市"), "山东省", "潍坊市", "寿光市", "");
    }

    @Test
    void testCityNameSharedWithDistricts() {
        assertParsed(parser.parse("辽宁朝阳"), "辽宁省", "朝阳市", null, "");
    }

    @Test
    void testCityFromOtherProvinceIsIgnored() {
        // 九龙 is a Hong Kong city but 九龙县 belongs to 甘孜
        assertParsed(parser.parse("四川九龙县"), "四川省", "甘孜藏族自治州", "九龙县", "");
    }

    @Test
    void testProvinceAndDistrictWithoutCity() {
        assertParsed(parser.parse("江西省西湖区"), "江西省", "南昌市", "西湖区", "");
    }

    @Test
    void testBannerDistrict() {
        assertParsed(parser.parse("额济纳旗"), "内蒙古自治区", "阿拉善盟", "额济纳旗", "");
    }

    @Test
    void testCityQualifiesSharedDistrict() {
        assertParsed(parser.parse("广州白云区"), "广东省", "广州市", "白云区", "");
        assertParsed(parser.parse("海口龙华区"), "海南省", "海口市", "龙华区", "");
    }

    @Test
    void testCityWithoutDistricts() {
        assertParsed(parser.parse("广东省东莞市长安镇"), "广东省", "东莞市", null, "长安镇");
    }

    @Test
    void testSpacesBetweenSegmentsStopMatching() {
        assertParsed(parser.parse("  广东省  深圳市  南山区  "), "广东省", null, null, "深圳市  南山区");
    }

    @Test
    void testDetailIsTrimmedOnBothEnds() {
        assertParsed(parser.parse("广东省 深圳市"), "广东省", null, null, "深圳市");
    }

    @Test
    void testSingleCharacterAbbreviationIsNotMatched() {
        // 赵县 would abbreviate to 赵, which is too short to be matched on its own
        assertParsed(parser.parse("赵家路1号"), null, null, null, "赵家路1号");
        assertParsed(parser.parse("赵县石塔路"), "河北省", "石家庄市", "赵县", "石塔路");
    }

    @Test
    void testDistrictsOfEveryPrefecture() {
        assertParsed(parser.parse("浙江省宁波市鄞州区"), "浙江省", "宁波市", "鄞州区", "");
        assertParsed(parser.parse("宁波鄞州区天童南路"), "浙江省", "宁波市", "鄞州区", "天童南路");
    }

    @Test
    void testUnrecognisedInput() {
        assertThat(parser.parse("")).isEqualTo(ParsedAddress.empty());
        assertThat(parser.parse("   ")).isEqualTo(ParsedAddress.empty());
        assertThat(parser.parse(null)).isEqualTo(ParsedAddress.empty());
        assertParsed(parser.parse("某某路123号"), null, null, null, "某某路123号");
    }

    @Test
    void testParseBatchKeepsInputOrder() {
        List<String> addresses = Arrays.asList("深圳南山科技园", null, "北京朝阳", "某某路123号", "广东省东莞市长安镇");

        List<ParsedAddress> results = parser.parseBatch(addresses);

        assertThat(results).hasSize(5);
        assertThat(results.get(0).district()).isEqualTo("南山区");
        assertThat(results.get(1)).isEqualTo(ParsedAddress.empty());
        assertThat(results.get(2).city()).isEqualTo("北京市");
        assertThat(results.get(3).detail()).isEqualTo("某某路123号");
        assertThat(results.get(4).city()).isEqualTo("东莞市");
        assertThat(parser.parseBatch(List.of())).isEmpty();
    }

    @Test
    void testIsValidAddress() {
        assertThat(parser.isValidAddress("广东省深圳市")).isTrue();
        assertThat(parser.isValidAddress("深圳南山")).isTrue();
        assertThat(parser.isValidAddress("朝阳区")).isFalse();
        assertThat(parser.isValidAddress("某某路123号")).isFalse();
        assertThat(parser.isValidAddress("")).isFalse();
    }

    @Test
    void testNormalize() {
        assertThat(parser.normalize("广东", "深圳", "南山")).isEqualTo("广东省深圳市南山区");
        assertThat(parser.normalize("广东省", "深圳市", null)).isEqualTo("广东省深圳市");
    }

    @Test
    void testLookups() {
        assertThat(parser.provinces()).hasSize(34);
        assertThat(parser.citiesOfProvince("广东")).contains("深圳市", "广州市");
        assertThat(parser.citiesOfProvince("广东省")).contains("深圳市", "广州市");
        assertThat(parser.citiesOfProvince("火星")).isEmpty();
        assertThat(parser.districtsOfCity("深圳")).contains("南山区", "福田区");
        assertThat(parser.districtsOfCity("东莞市")).isEmpty();
        assertThat(parser.districtsOfCity("火星市")).isEmpty();
    }

    @Test
    void testLookupsWithNullName() {
        assertThat(parser.citiesOfProvince(null)).isEmpty();
        assertThat(parser.districtsOfCity(null)).isEmpty();
        assertThat(parser.normalize(null, null, null)).isEmpty();
    }

    @Test
    void testInMemoryGazetteerWithProvinceAlias() {
        // 吉林 is claimed by the province alias before the 吉林市 abbreviation is consulted
        AddressParser small = new AddressParser(List.of(
                new Region("吉林省", "吉林市", "船营区"),
                new Region("吉林省", "长春市", "朝阳区")),
                Map.of("吉林", "吉林省"));

        ParsedAddress result = small.parse("吉林长春朝阳区");

        assertParsed(result, "吉林省", "长春市", "朝阳区", "");
    }

    @Test
    void testLongerDistrictReadingWinsWithoutProvince() {
        // 平安东市 belongs to 兴和市 and outmatches the 平安 abbreviation of 平安市
        AddressParser small = new AddressParser(List.of(
                new Region("浙江省", "平安市", "城南区"),
                new Region("浙江省", "兴和市", "平安东市")),
                Map.of());

        assertParsed(small.parse("平安东市人民路1号"), "浙江省", "兴和市", "平安东市", "人民路1号");
        assertParsed(small.parse("平安人民路1号"), "浙江省", "平安市", null, "人民路1号");
        assertParsed(small.parse("平安市城南区"), "浙江省", "平安市", "城南区", "");
    }

    @Test
    void testGlobalParserIsShared() {
        assertThat(AddressParser.global()).isSameAs(AddressParser.global());
    }
}
