/* (C)2026 */
package com.ammann.attention.resource;

import com.ammann.attention.dto.AnalyticsOverviewDTO;
import com.ammann.attention.dto.BehaviorEpisodesDTO;
import com.ammann.attention.dto.BehaviorEventDTO;
import com.ammann.attention.dto.BehavioralPatternDTO;
import com.ammann.attention.dto.EngagementMetricsDTO;
import com.ammann.attention.dto.IngestResultDTO;
import com.ammann.attention.dto.TimeOfDayStatsDTO;
import com.ammann.attention.dto.TrendPointDTO;
import com.ammann.attention.properties.ApiProperties;
import com.ammann.attention.service.AttentionReportService;
import com.ammann.attention.service.EngagementScorerService;
import com.ammann.attention.service.EpisodeService;
import com.ammann.attention.service.TransitionMinerService;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.enums.SchemaType;
import org.eclipse.microprofile.openapi.annotations.media.Content;
import org.eclipse.microprofile.openapi.annotations.media.Schema;
import org.eclipse.microprofile.openapi.annotations.parameters.Parameter;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;
import org.jboss.logging.Logger;

/**
 * REST resource for attention reports, behavioural patterns, episodes and domain engagement.
 *
 * <p>All reports are computed on request. Most cover a trailing window of {@code days} days,
 * clamped to 1-365; episodes take an explicit or hour-based range.
 */
@Path(ApiProperties.BASE_URL_V1)
@Tag(name = "Analytics API", description = "Attention reports over tracked activity")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class AnalyticsResource {

    private static final Logger LOG = Logger.getLogger(AnalyticsResource.class);

    @Inject AttentionReportService reportService;

    @Inject TransitionMinerService transitionMinerService;

    @Inject EngagementScorerService engagementScorerService;

    @Inject EpisodeService episodeService;

    @GET
    @Path(ApiProperties.Analytics.OVERVIEW)
    @Operation(
            summary = "Attention overview",
            description =
                    "Category totals, productivity score, peak and risk hours, focus trend, deep work and insights")
    @APIResponses({
        @APIResponse(
                responseCode = "200",
                description = "Overview computed",
                content =
                        @Content(schema = @Schema(implementation = AnalyticsOverviewDTO.class))),
        @APIResponse(responseCode = "500", description = "Internal server error")
    })
    public Response getOverview(
            @Parameter(description = "Trailing window in days (1-365)")
                    @QueryParam("days")
                    @DefaultValue("7")
                    int days) {
        LOG.debugf("Overview request: days=%d", days);
        return Response.ok(reportService.getOverview(days)).build();
    }

    @GET
    @Path(ApiProperties.Analytics.TIME_OF_DAY)
    @Operation(
            summary = "Time-of-day profile",
            description = "24 hourly buckets ordered from the configured day-start hour")
    @APIResponses({
        @APIResponse(
                responseCode = "200",
                description = "Profile computed",
                content =
                        @Content(
                                schema =
                                        @Schema(
                                                type = SchemaType.ARRAY,
                                                implementation = TimeOfDayStatsDTO.class)))
    })
    public Response getTimeOfDay(
            @Parameter(description = "Trailing window in days (1-365)")
                    @QueryParam("days")
                    @DefaultValue("7")
                    int days) {
        LOG.debugf("Time-of-day request: days=%d", days);
        return Response.ok(reportService.getTimeOfDayAnalysis(days)).build();
    }

    @GET
    @Path(ApiProperties.Analytics.TRENDS)
    @Operation(
            summary = "Trend series",
            description = "24 hourly, 30 daily or 12 weekly buckets of category totals")
    @APIResponses({
        @APIResponse(
                responseCode = "200",
                description = "Series computed",
                content =
                        @Content(
                                schema =
                                        @Schema(
                                                type = SchemaType.ARRAY,
                                                implementation = TrendPointDTO.class))),
        @APIResponse(responseCode = "400", description = "Unknown granularity")
    })
    public Response getTrends(
            @Parameter(description = "hour, day or week") @QueryParam("granularity")
                    @DefaultValue("day")
                    String granularity) {
        LOG.debugf("Trends request: granularity=%s", granularity);
        List<TrendPointDTO> points = reportService.getTrends(granularity);
        return Response.ok(points).build();
    }

    @GET
    @Path(ApiProperties.Analytics.ENGAGEMENT)
    @Operation(summary = "Domain engagement", description = "Engagement metrics for one domain")
    @APIResponses({
        @APIResponse(
                responseCode = "200",
                description = "Metrics computed",
                content =
                        @Content(schema = @Schema(implementation = EngagementMetricsDTO.class))),
        @APIResponse(responseCode = "400", description = "Missing domain")
    })
    public Response getEngagement(
            @Parameter(description = "Domain, e.g. github.com", required = true)
                    @QueryParam("domain")
                    String domain,
            @Parameter(description = "Trailing window in days (1-365)")
                    @QueryParam("days")
                    @DefaultValue("7")
                    int days) {
        LOG.debugf("Engagement request: domain=%s, days=%d", domain, days);
        return Response.ok(engagementScorerService.getEngagementMetrics(domain, days)).build();
    }

    @GET
    @Path(ApiProperties.Analytics.PATTERNS)
    @Operation(
            summary = "Behavioral patterns",
            description =
                    "Most frequent transitions between consecutive activities, recomputed when older than the configured maximum age")
    @APIResponses({
        @APIResponse(
                responseCode = "200",
                description = "Patterns returned",
                content =
                        @Content(
                                schema =
                                        @Schema(
                                                type = SchemaType.ARRAY,
                                                implementation = BehavioralPatternDTO.class)))
    })
    public Response getPatterns(
            @Parameter(description = "Window mined on recompute, in days (1-365)")
                    @QueryParam("days")
                    @DefaultValue("30")
                    int days) {
        return Response.ok(transitionMinerService.getBehavioralPatterns(days)).build();
    }

    @GET
    @Path(ApiProperties.Analytics.EPISODES)
    @Operation(
            summary = "Behaviour episodes",
            description =
                    "Activity split at gaps longer than gapMinutes, with category totals, event rates and a fixed-width timeline")
    @APIResponses({
        @APIResponse(
                responseCode = "200",
                description = "Episodes computed",
                content = @Content(schema = @Schema(implementation = BehaviorEpisodesDTO.class))),
        @APIResponse(responseCode = "400", description = "Malformed start or end")
    })
    public Response getEpisodes(
            @Parameter(description = "Range start (ISO-8601); defaults to end minus hours")
                    @QueryParam("start")
                    String start,
            @Parameter(description = "Range end (ISO-8601); defaults to now") @QueryParam("end")
                    String end,
            @Parameter(description = "Lookback when start is absent, in hours (1-336)")
                    @QueryParam("hours")
                    @DefaultValue("24")
                    int hours,
            @Parameter(description = "Gap that closes an episode, in minutes (1-120)")
                    @QueryParam("gapMinutes")
                    @DefaultValue("8")
                    int gapMinutes,
            @Parameter(description = "Timeline bin width in seconds (5-300)")
                    @QueryParam("binSeconds")
                    @DefaultValue("30")
                    int binSeconds,
            @Parameter(description = "Most recent episodes returned (1-500)")
                    @QueryParam("maxEpisodes")
                    @DefaultValue("100")
                    int maxEpisodes) {
        LOG.debugf(
                "Episodes request: start=%s, end=%s, hours=%d, gap=%d min",
                start, end, hours, gapMinutes);
        return Response.ok(
                        episodeService.getEpisodes(
                                start, end, hours, gapMinutes, binSeconds, maxEpisodes))
                .build();
    }

    @POST
    @Path(ApiProperties.Analytics.BEHAVIOR_EVENTS)
    @Operation(
            summary = "Ingest behaviour events",
            description = "Stores a batch of events; malformed events are skipped and reported")
    @APIResponses({
        @APIResponse(
                responseCode = "200",
                description = "Batch processed",
                content = @Content(schema = @Schema(implementation = IngestResultDTO.class))),
        @APIResponse(responseCode = "400", description = "Empty batch")
    })
    public Response ingestBehaviorEvents(List<BehaviorEventDTO> events) {
        IngestResultDTO result = engagementScorerService.ingestBehaviorEvents(events);
        LOG.infof(
                "Behavior event batch: %d received, %d stored", result.received(), result.accepted());
        return Response.ok(result).build();
    }
}
