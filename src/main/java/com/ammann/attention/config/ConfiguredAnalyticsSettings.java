/* (C)2026 */
package com.ammann.attention.config;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import java.time.ZoneId;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * {@link AnalyticsSettings} backed by {@code attention.*} entries in
 * {@code application.properties}.
 */
@ApplicationScoped
public class ConfiguredAnalyticsSettings implements AnalyticsSettings {

    private static final Logger LOG = Logger.getLogger(ConfiguredAnalyticsSettings.class);

    @ConfigProperty(name = "attention.privacy.excluded-keywords")
    Optional<List<String>> configuredKeywords;

    @ConfigProperty(name = "attention.day-start-hour", defaultValue = "4")
    int configuredDayStartHour;

    @ConfigProperty(name = "attention.zone", defaultValue = "UTC")
    String configuredZone;

    private List<String> keywords = List.of();
    private int dayStartHour;
    private ZoneId zone;

    @PostConstruct
    void init() {
        keywords = normalizeKeywords(configuredKeywords.orElse(List.of()));
        if (configuredDayStartHour < 0 || configuredDayStartHour > 23) {
            LOG.warnf(
                    "attention.day-start-hour=%d is outside 0-23, falling back to 4",
                    configuredDayStartHour);
            dayStartHour = 4;
        } else {
            dayStartHour = configuredDayStartHour;
        }
        zone = ZoneId.of(configuredZone);
        LOG.infof(
                "Analytics settings: dayStartHour=%d zone=%s excludedKeywords=%d",
                dayStartHour, zone, keywords.size());
    }

    static List<String> normalizeKeywords(List<String> raw) {
        return raw.stream()
                .filter(keyword -> keyword != null && !keyword.isBlank())
                .map(keyword -> keyword.trim().toLowerCase(Locale.ROOT))
                .distinct()
                .limit(MAX_EXCLUDED_KEYWORDS)
                .toList();
    }

    @Override
    public List<String> excludedKeywords() {
        return keywords;
    }

    @Override
    public int dayStartHour() {
        return dayStartHour;
    }

    @Override
    public ZoneId zone() {
        return zone;
    }
}
