package com.ammann.interaction.exception;

import jakarta.ws.rs.NotFoundException;
import jakarta.ws.rs.core.Response;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest
{
    private GlobalExceptionHandler handler;

    @BeforeEach
    void setUp()
    {
        handler = new GlobalExceptionHandler();
    }

    private static GlobalExceptionHandler.ErrorResponse body(Response response)
    {
        return (GlobalExceptionHandler.ErrorResponse) response.getEntity();
    }

    @Test
    void mapsUnknownContextTo404()
    {
        Response response = handler.toResponse(new NotFoundException("Unknown context: attic"));

        assertThat(response.getStatus()).isEqualTo(404);
        assertThat(body(response).code).isEqualTo("NOT_FOUND");
        assertThat(body(response).message).contains("attic");
        assertThat(body(response).path).isNull();
    }

    @Test
    void mapsInvalidDetectionToBadRequest()
    {
        Response response = handler.toResponse(InvalidDetectionException.unexpectedTopic("x/y"));

        assertThat(response.getStatus()).isEqualTo(Response.Status.BAD_REQUEST.getStatusCode());
        assertThat(body(response).code).isEqualTo("INVALID_DETECTION");
        assertThat(body(response).status).isEqualTo(400);
    }

    @Test
    void mapsConfigurationErrorTo500()
    {
        Response response = handler.toResponse(new SlotMatchingException("Crowd", 9, 8));

        assertThat(response.getStatus()).isEqualTo(500);
        assertThat(body(response).code).isEqualTo("CONFIGURATION_ERROR");
        assertThat(body(response).message).contains("Crowd");
    }

    @Test
    void hidesDetailsOfUnexpectedErrors()
    {
        Response response = handler.toResponse(new IllegalStateException("secret"));

        assertThat(response.getStatus()).isEqualTo(500);
        assertThat(body(response).code).isEqualTo("INTERNAL_ERROR");
        assertThat(body(response).message).doesNotContain("secret");
    }
}
