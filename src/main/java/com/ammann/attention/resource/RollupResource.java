/* (C)2026 */
package com.ammann.attention.resource;

import com.ammann.attention.dto.ActivityRollupDTO;
import com.ammann.attention.dto.ActivitySummaryDTO;
import com.ammann.attention.dto.RollupGenerateRequestDTO;
import com.ammann.attention.exception.ValidationException;
import com.ammann.attention.properties.ApiProperties;
import com.ammann.attention.service.RollupAccumulatorService;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.PUT;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import java.util.List;
import java.util.Map;
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
 * REST resource for hourly activity rollups: generation from raw intervals, sync upload and
 * download, and trailing-window summaries.
 */
@Path(ApiProperties.BASE_URL_V1)
@Tag(name = "Rollup API", description = "Hourly activity rollups")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class RollupResource {

    private static final Logger LOG = Logger.getLogger(RollupResource.class);

    @Inject RollupAccumulatorService rollupService;

    @POST
    @Path(ApiProperties.Rollups.GENERATE)
    @Operation(
            summary = "Generate rollups",
            description =
                    "Builds hourly rollups from intervals starting in [start, end) and stores them unless persist=false")
    @APIResponses({
        @APIResponse(
                responseCode = "200",
                description = "Rollups generated",
                content =
                        @Content(
                                schema =
                                        @Schema(
                                                type = SchemaType.ARRAY,
                                                implementation = ActivityRollupDTO.class))),
        @APIResponse(responseCode = "400", description = "Missing device or malformed timestamps")
    })
    public Response generate(
            RollupGenerateRequestDTO request,
            @Parameter(description = "Store the generated rollups") @QueryParam("persist")
                    @DefaultValue("true")
                    boolean persist) {
        if (request == null) {
            throw new ValidationException("Request body is required");
        }
        List<ActivityRollupDTO> rollups =
                rollupService.generateLocalRollups(
                        request.deviceId(), request.start(), request.end());
        if (persist) {
            rollupService.upsertRollups(rollups);
        }
        LOG.infof(
                "Generated %d rollups for device %s (persisted=%s)",
                rollups.size(), request.deviceId(), persist);
        return Response.ok(rollups).build();
    }

    @PUT
    @Path(ApiProperties.Rollups.BASE)
    @Operation(
            summary = "Upsert rollups",
            description = "Stores rollups, overwriting existing rows with the same device and hour")
    @APIResponses({
        @APIResponse(responseCode = "200", description = "Rollups stored"),
        @APIResponse(responseCode = "400", description = "Invalid rollup")
    })
    public Response upsert(List<ActivityRollupDTO> rollups) {
        int written = rollupService.upsertRollups(rollups);
        return Response.ok(Map.of("upserted", written)).build();
    }

    @GET
    @Path(ApiProperties.Rollups.SINCE)
    @Operation(
            summary = "Rollups updated since",
            description = "Rollups of a device generated at or after updatedAfter, ordered by hour")
    @APIResponses({
        @APIResponse(
                responseCode = "200",
                description = "Rollups returned",
                content =
                        @Content(
                                schema =
                                        @Schema(
                                                type = SchemaType.ARRAY,
                                                implementation = ActivityRollupDTO.class))),
        @APIResponse(responseCode = "400", description = "Missing device or malformed timestamp")
    })
    public Response since(
            @Parameter(description = "Device identifier", required = true)
                    @QueryParam("deviceId")
                    String deviceId,
            @Parameter(description = "ISO-8601 timestamp", required = true)
                    @QueryParam("updatedAfter")
                    String updatedAfter) {
        return Response.ok(rollupService.listSince(deviceId, updatedAfter)).build();
    }

    @GET
    @Path(ApiProperties.Rollups.SUMMARY)
    @Operation(
            summary = "Rollup summary",
            description = "Totals and hourly timeline over the trailing windowHours (1-168)")
    @APIResponses({
        @APIResponse(
                responseCode = "200",
                description = "Summary computed",
                content = @Content(schema = @Schema(implementation = ActivitySummaryDTO.class)))
    })
    public Response summary(
            @Parameter(description = "Device identifier, all devices when absent")
                    @QueryParam("deviceId")
                    String deviceId,
            @Parameter(description = "Window length in hours (1-168)")
                    @QueryParam("windowHours")
                    @DefaultValue("24")
                    int windowHours) {
        return Response.ok(rollupService.getSummary(deviceId, windowHours)).build();
    }
}
