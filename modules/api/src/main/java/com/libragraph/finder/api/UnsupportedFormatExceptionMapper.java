package com.libragraph.finder.api;

import com.libragraph.finder.formats.api.UnsupportedFormatException;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.jboss.logging.Logger;

@Provider
public class UnsupportedFormatExceptionMapper implements ExceptionMapper<UnsupportedFormatException> {

    private static final Logger log = Logger.getLogger(UnsupportedFormatExceptionMapper.class);

    @Override
    public Response toResponse(UnsupportedFormatException e) {
        log.debugf("Unsupported upload: %s", e.getMessage());
        return ErrorResponse.build(Response.Status.UNSUPPORTED_MEDIA_TYPE, e.getMessage());
    }
}
