package com.ammann.interaction.exception;

import jakarta.ws.rs.NotFoundException;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriInfo;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.jboss.logging.Logger;

import java.time.Instant;

/**
 * Maps exceptions escaping the read-only REST API to JSON error bodies.
 *
 * <p>Unknown contexts yield 404; anything unexpected is logged and returned as 500.
 */
@Provider
public class GlobalExceptionHandler implements ExceptionMapper<Exception>
{
    private static final Logger LOG = Logger.getLogger(GlobalExceptionHandler.class);

    @Context
    UriInfo uriInfo;

    @Override
    public Response toResponse(Exception exception)
    {
        String path = uriInfo != null ? uriInfo.getPath() : null;

        if (exception instanceof NotFoundException) {
            return createResponse(
                    Response.Status.NOT_FOUND,
                    exception.getMessage(),
                    "NOT_FOUND",
                    path
            );
        }

        if (exception instanceof InvalidDetectionException) {
            return createResponse(
                    Response.Status.BAD_REQUEST,
                    exception.getMessage(),
                    "INVALID_DETECTION",
                    path
            );
        }

        if (exception instanceof InteractionConfigurationException) {
            LOG.errorf("Interaction configuration error: %s", exception.getMessage());
            return createResponse(
                    Response.Status.INTERNAL_SERVER_ERROR,
                    exception.getMessage(),
                    "CONFIGURATION_ERROR",
                    path
            );
        }

        LOG.error("Unhandled exception: " + exception.getClass().getSimpleName(), exception);
        return createResponse(
                Response.Status.INTERNAL_SERVER_ERROR,
                "An unexpected error occurred",
                "INTERNAL_ERROR",
                path
        );
    }

    private Response createResponse(Response.Status status, String message, String code, String path)
    {
        return Response.status(status)
                .entity(new ErrorResponse(code, message, path, status.getStatusCode()))
                .build();
    }

    /**
     * JSON error body: machine-readable code, message, request path and HTTP status.
     */
    public static class ErrorResponse
    {
        public final String code;
        public final String message;
        public final Instant timestamp;
        public final String path;
        public final int status;

        public ErrorResponse(String code, String message, String path, int status)
        {
            this.code = code;
            this.message = message;
            this.timestamp = Instant.now();
            this.path = path;
            this.status = status;
        }
    }
}
