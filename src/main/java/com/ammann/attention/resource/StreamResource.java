/* (C)2026 */
package com.ammann.attention.resource;

import com.ammann.attention.dto.ReadingProgressDTO;
import com.ammann.attention.dto.WritingProgressDTO;
import com.ammann.attention.properties.ApiProperties;
import com.ammann.attention.service.AuxiliaryRollupService;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.Operation;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponse;
import org.eclipse.microprofile.openapi.annotations.responses.APIResponses;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;

/**
 * Progress intake for the reading and writing subsystems.
 */
@Path(ApiProperties.BASE_URL_V1)
@Tag(name = "Stream API", description = "Reading and writing progress")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class StreamResource {

    @Inject AuxiliaryRollupService auxiliaryRollupService;

    @POST
    @Path(ApiProperties.Streams.WRITING_PROGRESS)
    @Operation(summary = "Record writing progress", description = "Adds a delta to the writing rollups")
    @APIResponses({
        @APIResponse(responseCode = "204", description = "Progress recorded"),
        @APIResponse(responseCode = "400", description = "Negative time delta")
    })
    public Response recordWriting(WritingProgressDTO delta) {
        auxiliaryRollupService.recordWritingProgress(delta);
        return Response.noContent().build();
    }

    @POST
    @Path(ApiProperties.Streams.READING_PROGRESS)
    @Operation(summary = "Record reading progress", description = "Adds a delta to the reading rollups")
    @APIResponses({
        @APIResponse(responseCode = "204", description = "Progress recorded"),
        @APIResponse(responseCode = "400", description = "Negative time delta")
    })
    public Response recordReading(ReadingProgressDTO delta) {
        auxiliaryRollupService.recordReadingProgress(delta);
        return Response.noContent().build();
    }
}
