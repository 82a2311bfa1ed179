package io.specado.core.model;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class SemanticVersionTest {

    @Test
    void parsesPlainVersion() {
        assertThat(SemanticVersion.parse("1.2.3")).contains(new SemanticVersion(1, 2, 3));
    }

    @Test
    void ignoresPrefixAndSuffixes() {
        assertThat(SemanticVersion.parse("v1.0.0")).contains(new SemanticVersion(1, 0, 0));
        assertThat(SemanticVersion.parse("1.4.0-beta.2")).contains(new SemanticVersion(1, 4, 0));
        assertThat(SemanticVersion.parse("2.0.1+build.7")).contains(new SemanticVersion(2, 0, 1));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "1", "1.0", "1.0.0.0", "one.two.three", "1.-1.0"})
    void rejectsMalformedVersions(String text) {
        assertThat(SemanticVersion.parse(text)).isEmpty();
    }

    @Test
    void ordersNumerically() {
        assertThat(new SemanticVersion(1, 10, 0)).isGreaterThan(new SemanticVersion(1, 9, 9));
        assertThat(new SemanticVersion(2, 0, 0)).isGreaterThan(new SemanticVersion(1, 99, 99));
        assertThat(new SemanticVersion(1, 0, 0)).isEqualByComparingTo(SemanticVersion.parse("1.0.0").orElseThrow());
    }

    @Test
    void printsCanonicalForm() {
        assertThat(SemanticVersion.parse("v3.1.4-rc1").orElseThrow()).hasToString("3.1.4");
    }
}
