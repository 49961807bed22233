package com.regionmatch.utils;

import static org.assertj.core.api.Assertions.*;

import com.regionmatch.matching.ParsedAddress;
import org.junit.jupiter.api.Test;

import java.util.List;

class AddressUtilsTest {

    @Test
    void testParse() {
        ParsedAddress result = AddressUtils.parse("北京市朝阳区望京");

        assertThat(result).isEqualTo(new ParsedAddress("北京市", "北京市", "朝阳区", "望京"));
    }

    @Test
    void testParseBatch() {
        List<ParsedAddress> results = AddressUtils.parseBatch(List.of("深圳南山科技园", "某某路123号"));

        assertThat(results).extracting(ParsedAddress::city).containsExactly("深圳市", null);
    }

    @Test
    void testNormalize() {
        assertThat(AddressUtils.normalize("广东", "深圳", "南山")).isEqualTo("广东省深圳市南山区");
    }

    @Test
    void testIsValidAddress() {
        assertThat(AddressUtils.isValidAddress("广东省深圳市南山区")).isTrue();
        assertThat(AddressUtils.isValidAddress("某某路123号")).isFalse();
    }
}
