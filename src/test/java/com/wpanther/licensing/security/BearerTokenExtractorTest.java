package com.wpanther.licensing.security;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class BearerTokenExtractorTest {

    private final BearerTokenExtractor extractor = new BearerTokenExtractor();

    @Test
    void testExtract_ReturnsToken() {
        assertThat(extractor.extract("Bearer abc.def.ghi")).contains("abc.def.ghi");
    }

    @Test
    void testExtract_SchemeIsCaseInsensitive() {
        assertThat(extractor.extract("bearer abc")).contains("abc");
        assertThat(extractor.extract("BEARER abc")).contains("abc");
    }

    @Test
    void testExtract_MissingHeader() {
        assertThat(extractor.extract(null)).isEmpty();
        assertThat(extractor.extract("   ")).isEmpty();
    }

    @Test
    void testExtract_OtherSchemesAreIgnored() {
        assertThat(extractor.extract("Basic dXNlcjpwYXNz")).isEmpty();
        assertThat(extractor.extract("Bearerabc")).isEmpty();
    }

    @Test
    void testExtract_EmptyOrSplitToken() {
        assertThat(extractor.extract("Bearer ")).isEmpty();
        assertThat(extractor.extract("Bearer abc def")).isEmpty();
    }
}
