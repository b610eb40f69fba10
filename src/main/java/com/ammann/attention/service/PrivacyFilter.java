/* (C)2026 */
package com.ammann.attention.service;

import com.ammann.attention.config.AnalyticsSettings;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.List;
import java.util.Locale;
import org.jboss.logging.Logger;

/**
 * Decides whether an activity must be hidden from domain-level output.
 *
 * <p>A suppressed activity still counts towards totals, but as {@code neutral} time and without
 * its domain.
 */
@ApplicationScoped
public class PrivacyFilter {

    private static final Logger LOG = Logger.getLogger(PrivacyFilter.class);

    private final AnalyticsSettings settings;

    @Inject
    public PrivacyFilter(AnalyticsSettings settings) {
        this.settings = settings;
    }

    /**
     * Returns whether the domain or app name contains any excluded keyword (case-insensitive).
     * A failing settings lookup suppresses nothing.
     */
    public boolean isSuppressed(String domain, String appName) {
        if (domain == null && appName == null) {
            return false;
        }
        List<String> keywords;
        try {
            keywords = settings.excludedKeywords();
        } catch (RuntimeException e) {
            LOG.warnf("Privacy keyword lookup failed, not suppressing: %s", e.getMessage());
            return false;
        }
        if (keywords == null || keywords.isEmpty()) {
            return false;
        }
        String haystack =
                ((domain != null ? domain : "") + " " + (appName != null ? appName : ""))
                        .toLowerCase(Locale.ROOT);
        for (String keyword : keywords) {
            if (!keyword.isEmpty() && haystack.contains(keyword)) {
                return true;
            }
        }
        return false;
    }
}
