package com.libragraph.finder.api;

import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

/**
 * JSON body returned for failed requests.
 */
public record ErrorResponse(int status, String error, String message) {

    static Response build(Response.Status status, String message) {
        return build(status.getStatusCode(), status.getReasonPhrase(), message);
    }

    static Response build(int status, String error, String message) {
        return Response.status(status)
                .type(MediaType.APPLICATION_JSON)
                .entity(new ErrorResponse(status, error, message))
                .build();
    }
}
