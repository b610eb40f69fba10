/* (C)2026 */
package com.ammann.attention.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Test;

class ConfiguredAnalyticsSettingsTest {

    private static ConfiguredAnalyticsSettings settings(
            List<String> keywords, int dayStartHour, String zone) {
        ConfiguredAnalyticsSettings settings = new ConfiguredAnalyticsSettings();
        settings.configuredKeywords = Optional.ofNullable(keywords);
        settings.configuredDayStartHour = dayStartHour;
        settings.configuredZone = zone;
        settings.init();
        return settings;
    }

    @Test
    void keywordsAreTrimmedLowerCasedAndDeduplicated() {
        List<String> raw = new ArrayList<>(Arrays.asList(" Casino ", "casino", "", null, "HEALTH"));

        assertThat(ConfiguredAnalyticsSettings.normalizeKeywords(raw))
                .containsExactly("casino", "health");
    }

    @Test
    void keywordListIsCapped() {
        List<String> raw = IntStream.range(0, 80).mapToObj(i -> "kw" + i).toList();

        assertThat(ConfiguredAnalyticsSettings.normalizeKeywords(raw))
                .hasSize(AnalyticsSettings.MAX_EXCLUDED_KEYWORDS)
                .startsWith("kw0", "kw1");
    }

    @Test
    void readsConfiguredValues() {
        ConfiguredAnalyticsSettings settings =
                settings(List.of("Casino"), 6, "Europe/Zurich");

        assertThat(settings.excludedKeywords()).containsExactly("casino");
        assertThat(settings.dayStartHour()).isEqualTo(6);
        assertThat(settings.zone()).isEqualTo(ZoneId.of("Europe/Zurich"));
    }

    @Test
    void outOfRangeDayStartFallsBackToFour() {
        assertThat(settings(null, 24, "UTC").dayStartHour()).isEqualTo(4);
        assertThat(settings(null, -1, "UTC").dayStartHour()).isEqualTo(4);
        assertThat(settings(null, 0, "UTC").dayStartHour()).isZero();
    }

    @Test
    void absentKeywordsMeanNothingIsSuppressed() {
        assertThat(settings(null, 4, "UTC").excludedKeywords()).isEmpty();
    }
}
