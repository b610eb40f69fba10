/* (C)2026 */
package com.ammann.attention.exception;

import jakarta.ws.rs.NotFoundException;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriInfo;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import java.time.LocalDateTime;
import org.jboss.logging.Logger;

/**
 * Translates exceptions thrown by the REST resources into structured JSON error responses.
 *
 * <p>Validation failures become HTTP 400, unknown paths HTTP 404. Anything unhandled is
 * logged at ERROR level and returned as HTTP 500.
 */
@Provider
public class GlobalExceptionHandler implements ExceptionMapper<Exception> {

    private static final Logger LOG = Logger.getLogger(GlobalExceptionHandler.class);

    @Context UriInfo uriInfo;

    @Override
    public Response toResponse(Exception exception) {
        String path = uriInfo != null ? uriInfo.getPath() : null;

        if (exception instanceof ValidationException) {
            LOG.debugf("Rejected request to %s: %s", path, exception.getMessage());
            return createResponse(
                    Response.Status.BAD_REQUEST, exception.getMessage(), "VALIDATION_ERROR", path);
        }

        if (exception instanceof NotFoundException) {
            return createResponse(
                    Response.Status.NOT_FOUND, exception.getMessage(), "NOT_FOUND", path);
        }

        // Malformed JSON bodies and other framework-level client errors
        if (exception instanceof WebApplicationException wae
                && wae.getResponse().getStatus() < 500) {
            Response.Status status = Response.Status.fromStatusCode(wae.getResponse().getStatus());
            return createResponse(
                    status != null ? status : Response.Status.BAD_REQUEST,
                    exception.getMessage(),
                    "CLIENT_ERROR",
                    path);
        }

        LOG.error("Unhandled exception: " + exception.getClass().getSimpleName(), exception);
        return createResponse(
                Response.Status.INTERNAL_SERVER_ERROR,
                "An unexpected error occurred",
                "INTERNAL_ERROR",
                path);
    }

    private Response createResponse(
            Response.Status status, String message, String code, String path) {
        ErrorResponse errorResponse =
                new ErrorResponse(code, message, path, status.getStatusCode());
        return Response.status(status).entity(errorResponse).build();
    }

    /**
     * Structured error body returned to API clients.
     */
    public static class ErrorResponse {
        public String code;
        public String message;
        public LocalDateTime timestamp;
        public String path;
        public Integer status;

        public ErrorResponse(String code, String message) {
            this.code = code;
            this.message = message;
            this.timestamp = LocalDateTime.now();
        }

        public ErrorResponse(String code, String message, String path, Integer status) {
            this(code, message);
            this.path = path;
            this.status = status;
        }
    }
}
