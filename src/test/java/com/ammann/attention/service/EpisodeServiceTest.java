/* (C)2026 */
package com.ammann.attention.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.ammann.attention.config.AnalyticsSettings;
import com.ammann.attention.dto.BehaviorEpisodeDTO;
import com.ammann.attention.dto.BehaviorEpisodesDTO;
import com.ammann.attention.dto.ContextSecondsDTO;
import com.ammann.attention.dto.EpisodeQueryDTO;
import com.ammann.attention.dto.EpisodeTimelineBinDTO;
import com.ammann.attention.enumeration.ActivityCategory;
import com.ammann.attention.exception.ValidationException;
import com.ammann.attention.model.ActivityInterval;
import com.ammann.attention.support.InMemoryIntervalStore;
import com.ammann.attention.support.MutableClock;
import com.ammann.attention.support.TestDataFactory;
import com.ammann.attention.support.TestSettings;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class EpisodeServiceTest {

    private InMemoryIntervalStore store;
    private MutableClock clock;

    @BeforeEach
    void setUp() {
        store = new InMemoryIntervalStore();
        clock = MutableClock.at("2026-03-03T00:00:00Z");
    }

    private EpisodeService service(AnalyticsSettings settings) {
        return new EpisodeService(
                store, new IntervalParser(new SimpleMeterRegistry()), new PrivacyFilter(settings), clock);
    }

    private EpisodeService service() {
        return service(TestSettings.defaults());
    }

    private BehaviorEpisodesDTO lastDay(int binSeconds, int maxEpisodes) {
        return service().getEpisodes(null, null, 24, 8, binSeconds, maxEpisodes);
    }

    private void seedMorning() {
        store.add(
                TestDataFactory.interval("2026-03-02T09:00:00Z", "2026-03-02T09:20:00Z", "github.com", ActivityCategory.PRODUCTIVE),
                TestDataFactory.interval("2026-03-02T09:25:00Z", "2026-03-02T09:40:00Z", "youtube.com", ActivityCategory.FRIVOLITY),
                TestDataFactory.interval("2026-03-02T10:00:00Z", "2026-03-02T10:10:00Z", "github.com", ActivityCategory.PRODUCTIVE),
                TestDataFactory.interval("2026-03-02T12:00:00Z", "2026-03-02T12:05:00Z", "docs.com", ActivityCategory.NEUTRAL));
    }

    @Test
    void gapsLongerThanThresholdSplitEpisodes() {
        seedMorning();

        BehaviorEpisodesDTO result = lastDay(300, 100);

        assertThat(result.episodes()).hasSize(3);
        BehaviorEpisodeDTO first = result.episodes().get(0);
        assertThat(first.id()).isEqualTo("ep-" + Instant.parse("2026-03-02T09:00:00Z").toEpochMilli() + "-1");
        assertThat(first.end()).isEqualTo(Instant.parse("2026-03-02T09:40:00Z"));
        assertThat(first.durationSeconds()).isEqualTo(2400);
        assertThat(first.activeSeconds()).isEqualTo(2100);
        assertThat(first.categoryBreakdown().productive()).isEqualTo(1200);
        assertThat(first.categoryBreakdown().frivolity()).isEqualTo(900);
        assertThat(first.dominantCategory()).isEqualTo("productive");
        assertThat(first.domainSwitches()).isEqualTo(1);
        assertThat(first.topDomains())
                .containsExactly(
                        new ContextSecondsDTO("github.com", 1200),
                        new ContextSecondsDTO("youtube.com", 900));
    }

    @Test
    void summaryAddsUpReturnedEpisodes() {
        seedMorning();

        BehaviorEpisodesDTO result = lastDay(300, 100);

        assertThat(result.summary().totalEpisodes()).isEqualTo(3);
        assertThat(result.summary().totalDurationSeconds()).isEqualTo(2400 + 600 + 300);
        assertThat(result.summary().totalActiveSeconds()).isEqualTo(3000);
        assertThat(result.summary().topDomains())
                .extracting(ContextSecondsDTO::name)
                .containsExactly("github.com", "youtube.com", "docs.com");
        assertThat(result.summary().topDomains().get(0).activeSeconds()).isEqualTo(1800);
    }

    @Test
    void maxEpisodesKeepsTheMostRecent() {
        seedMorning();

        List<BehaviorEpisodeDTO> episodes = lastDay(300, 2).episodes();

        assertThat(episodes).extracting(BehaviorEpisodeDTO::start)
                .containsExactly(
                        Instant.parse("2026-03-02T10:00:00Z"), Instant.parse("2026-03-02T12:00:00Z"));
        assertThat(episodes.get(0).id()).endsWith("-1");
        assertThat(episodes.get(1).id()).endsWith("-2");
    }

    @ParameterizedTest
    @CsvSource({"09:18:00, 1", "09:18:01, 2"})
    void gapEqualToThresholdKeepsEpisodeOpen(String secondStart, int expectedEpisodes) {
        store.add(
                TestDataFactory.interval("2026-03-02T09:00:00Z", "2026-03-02T09:10:00Z", "a.com", ActivityCategory.NEUTRAL),
                TestDataFactory.interval("2026-03-02T" + secondStart + "Z", "2026-03-02T09:30:00Z", "a.com", ActivityCategory.NEUTRAL));

        assertThat(lastDay(300, 100).episodes()).hasSize(expectedEpisodes);
    }

    @Test
    void parametersAreClamped() {
        EpisodeQueryDTO low = service().getEpisodes(null, null, 0, 0, 1, 0).query();
        EpisodeQueryDTO high = service().getEpisodes(null, null, 10_000, 500, 1_000, 9_999).query();

        assertThat(low.hours()).isEqualTo(1);
        assertThat(low.gapMinutes()).isEqualTo(1);
        assertThat(low.binSeconds()).isEqualTo(EpisodeService.MIN_BIN_SECONDS);
        assertThat(low.maxEpisodes()).isEqualTo(1);
        assertThat(low.start()).isEqualTo(Instant.parse("2026-03-02T23:00:00Z"));
        assertThat(high.hours()).isEqualTo(336);
        assertThat(high.gapMinutes()).isEqualTo(120);
        assertThat(high.binSeconds()).isEqualTo(300);
        assertThat(high.maxEpisodes()).isEqualTo(500);
    }

    @Test
    void reversedRangeIsSwappedAndActivityClipped() {
        store.add(
                TestDataFactory.interval(
                        "2026-03-02T08:30:00Z", "2026-03-02T09:30:00Z", "github.com",
                        ActivityCategory.PRODUCTIVE));

        BehaviorEpisodesDTO result =
                service().getEpisodes("2026-03-02T09:30:00Z", "2026-03-02T09:00:00Z", 24, 8, 300, 100);

        assertThat(result.window().start()).isEqualTo(Instant.parse("2026-03-02T09:00:00Z"));
        assertThat(result.window().end()).isEqualTo(Instant.parse("2026-03-02T09:30:00Z"));
        assertThat(result.episodes()).singleElement().satisfies(e -> {
            assertThat(e.start()).isEqualTo(Instant.parse("2026-03-02T09:00:00Z"));
            assertThat(e.activeSeconds()).isEqualTo(1800);
        });
    }

    @Test
    void malformedBoundIsRejected() {
        assertThatThrownBy(() -> service().getEpisodes(null, "soon", 24, 8, 30, 100))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("end");
    }

    @Test
    void suppressedActivityIsNeutralAndHidesItsName() {
        ActivityInterval firefox =
                TestDataFactory.interval(
                        "2026-03-02T09:00:00Z", "2026-03-02T09:10:00Z", "github.com",
                        ActivityCategory.PRODUCTIVE);
        firefox.appName = "Firefox";
        ActivityInterval casino =
                TestDataFactory.interval(
                        "2026-03-02T09:10:00Z", "2026-03-02T09:20:00Z", "casino.example",
                        ActivityCategory.FRIVOLITY);
        casino.appName = "Chrome";
        store.add(
                firefox,
                casino,
                TestDataFactory.interval(
                        "2026-03-02T09:20:00Z", "2026-03-02T09:30:00Z", "github.com",
                        ActivityCategory.PRODUCTIVE));

        BehaviorEpisodeDTO episode =
                service(TestSettings.excluding("casino"))
                        .getEpisodes(null, null, 24, 8, 300, 100)
                        .episodes()
                        .get(0);

        assertThat(episode.categoryBreakdown().frivolity()).isZero();
        assertThat(episode.categoryBreakdown().neutral()).isEqualTo(600);
        assertThat(episode.topDomains()).containsExactly(new ContextSecondsDTO("github.com", 1200));
        assertThat(episode.topApps()).containsExactly(new ContextSecondsDTO("Firefox", 600));
        assertThat(episode.domainSwitches()).isZero();
        assertThat(episode.timelineBins())
                .extracting(EpisodeTimelineBinDTO::topDomain)
                .containsExactly("github.com", "github.com", null, null, "github.com", "github.com");
    }

    @Test
    void appOnlyActivityIsNamedByApplication() {
        store.add(
                TestDataFactory.appInterval(
                        "2026-03-02T09:00:00Z", "2026-03-02T09:05:00Z", "Slack",
                        ActivityCategory.FRIVOLITY));

        BehaviorEpisodeDTO episode = lastDay(300, 100).episodes().get(0);

        assertThat(episode.topDomains()).containsExactly(new ContextSecondsDTO("Slack", 300));
        assertThat(episode.topApps()).containsExactly(new ContextSecondsDTO("Slack", 300));
    }

    @Test
    void eventsOfEveryDomainFeedCountsRatesAndBins() {
        store.add(
                TestDataFactory.interval(
                        "2026-03-02T09:00:00Z", "2026-03-02T09:02:00Z", "github.com",
                        ActivityCategory.PRODUCTIVE));
        store.behaviorEvents.addAll(
                List.of(
                        TestDataFactory.event("2026-03-02T09:00:10Z", "github.com", "click", 3L, null),
                        TestDataFactory.event("2026-03-02T09:00:20Z", "other.com", "scroll", null, 250.0),
                        TestDataFactory.event("2026-03-02T09:00:30Z", "github.com", "wheel", null, null),
                        TestDataFactory.event("2026-03-02T09:01:30Z", "github.com", "keystroke", null, null),
                        TestDataFactory.event("2026-03-02T09:01:59Z", "github.com", "focus", null, null),
                        TestDataFactory.event("2026-03-02T09:02:00Z", "github.com", "blur", 0L, null),
                        TestDataFactory.event("2026-03-02T09:30:00Z", "github.com", "click", null, null)));

        BehaviorEpisodeDTO episode = lastDay(60, 100).episodes().get(0);

        assertThat(episode.eventCounts().click()).isEqualTo(3);
        assertThat(episode.eventCounts().scroll()).isEqualTo(1);
        assertThat(episode.eventCounts().keystroke()).isEqualTo(1);
        assertThat(episode.eventCounts().focus()).isEqualTo(1);
        assertThat(episode.eventCounts().blur()).isEqualTo(1);
        assertThat(episode.rates().actionsPerMinute()).isEqualTo(2.5);
        assertThat(episode.rates().clicksPerMinute()).isEqualTo(1.5);
        assertThat(episode.rates().scrollsPerMinute()).isEqualTo(0.5);
        assertThat(episode.rates().keystrokesPerMinute()).isEqualTo(0.5);
        assertThat(episode.rates().focusEventsPerMinute()).isEqualTo(1.0);

        assertThat(episode.timelineBins()).hasSize(2);
        EpisodeTimelineBinDTO firstBin = episode.timelineBins().get(0);
        assertThat(firstBin.activeSeconds()).isEqualTo(60);
        assertThat(firstBin.eventCounts().click()).isEqualTo(3);
        assertThat(firstBin.eventCounts().scroll()).isEqualTo(1);
        assertThat(firstBin.topDomain()).isEqualTo("github.com");
        EpisodeTimelineBinDTO secondBin = episode.timelineBins().get(1);
        assertThat(secondBin.eventCounts().keystroke()).isEqualTo(1);
        assertThat(secondBin.eventCounts().blur()).as("end instant is outside the last bin").isZero();
    }

    @Test
    void lastBinIsCutAtEpisodeEnd() {
        store.add(
                TestDataFactory.interval(
                        "2026-03-02T09:00:00Z", "2026-03-02T09:02:00Z", "github.com",
                        ActivityCategory.PRODUCTIVE));

        List<EpisodeTimelineBinDTO> bins = lastDay(50, 100).episodes().get(0).timelineBins();

        assertThat(bins).hasSize(3);
        assertThat(bins.get(2).start()).isEqualTo(Instant.parse("2026-03-02T09:01:40Z"));
        assertThat(bins.get(2).end()).isEqualTo(Instant.parse("2026-03-02T09:02:00Z"));
        assertThat(bins.get(2).activeSeconds()).isEqualTo(20);
        assertThat(bins.get(2).categoryBreakdown().productive()).isEqualTo(20);
    }

    @Test
    void emptyRangeHasNoEpisodes() {
        BehaviorEpisodesDTO result = lastDay(30, 100);

        assertThat(result.episodes()).isEmpty();
        assertThat(result.summary().totalEpisodes()).isZero();
        assertThat(result.summary().topDomains()).isEmpty();
        assertThat(result.generatedAt()).isEqualTo(clock.instant());
    }
}
