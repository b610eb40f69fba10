/* (C)2026 */
package com.ammann.attention.service;

import com.ammann.attention.enumeration.FocusTrend;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Produces short human-readable observations for the overview report.
 */
@ApplicationScoped
public class InsightGenerator {

    public static final int MAX_INSIGHTS = 5;

    static final double RISK_SHARE_OF_PRODUCTIVE = 0.30;
    static final double HIGH_IDLE_RATIO = 0.30;
    static final double HIGH_DISTRACTION_RATIO = 0.25;
    static final double LOW_DISTRACTION_RATIO = 0.10;

    /**
     * Figures the insights are derived from. Seconds are totals over the report window.
     */
    public record Facts(
            int peakProductiveHour,
            int riskHour,
            double productiveSeconds,
            double distractionSeconds,
            double activeSeconds,
            double idleSeconds,
            FocusTrend focusTrend,
            double readingSeconds,
            double writingSeconds) {}

    public List<String> generate(Facts facts) {
        List<String> insights = new ArrayList<>();

        if (facts.readingSeconds() > 0 || facts.writingSeconds() > 0) {
            insights.add(
                    String.format(
                            Locale.ROOT,
                            "Deep reading and writing added %.1f h of productive time (%.1f h reading, %.1f h writing).",
                            (facts.readingSeconds() + facts.writingSeconds()) / 3600.0,
                            facts.readingSeconds() / 3600.0,
                            facts.writingSeconds() / 3600.0));
        }

        if (facts.productiveSeconds() > 0) {
            insights.add(
                    String.format(
                            "Your focus peaks around %s; protect that hour for demanding work.",
                            formatHour(facts.peakProductiveHour())));
        }

        if (facts.distractionSeconds() > 0
                && facts.distractionSeconds()
                        > facts.productiveSeconds() * RISK_SHARE_OF_PRODUCTIVE) {
            insights.add(
                    String.format(
                            "Distractions cluster around %s.", formatHour(facts.riskHour())));
        }

        if (facts.focusTrend() == FocusTrend.IMPROVING) {
            insights.add("Productive time is trending up compared to earlier in the period.");
        } else if (facts.focusTrend() == FocusTrend.DECLINING) {
            insights.add("Productive time is trending down compared to earlier in the period.");
        }

        double tracked = facts.activeSeconds() + facts.idleSeconds();
        if (tracked > 0 && facts.idleSeconds() / tracked > HIGH_IDLE_RATIO) {
            insights.add(
                    String.format(
                            "Idle time makes up %d%% of tracked time.",
                            Math.round(facts.idleSeconds() / tracked * 100.0)));
        }

        if (facts.activeSeconds() > 0) {
            double ratio = facts.distractionSeconds() / facts.activeSeconds();
            if (ratio > HIGH_DISTRACTION_RATIO) {
                insights.add(
                        String.format(
                                "High distraction: %d%% of active time went to frivolous or draining activities.",
                                Math.round(ratio * 100.0)));
            } else if (ratio < LOW_DISTRACTION_RATIO) {
                insights.add(
                        String.format(
                                "Excellent focus: only %d%% of active time was distracted.",
                                Math.round(ratio * 100.0)));
            }
        }

        return insights.size() > MAX_INSIGHTS
                ? List.copyOf(insights.subList(0, MAX_INSIGHTS))
                : List.copyOf(insights);
    }

    static String formatHour(int hour) {
        return String.format("%02d:00", hour);
    }
}
