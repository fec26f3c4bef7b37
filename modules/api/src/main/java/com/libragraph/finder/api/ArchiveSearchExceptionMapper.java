package com.libragraph.finder.api;

import com.libragraph.finder.core.search.ArchiveSearchException;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.jboss.logging.Logger;

/**
 * Unreadable archives are the client's problem, reported as 422.
 */
@Provider
public class ArchiveSearchExceptionMapper implements ExceptionMapper<ArchiveSearchException> {

    private static final Logger log = Logger.getLogger(ArchiveSearchExceptionMapper.class);

    static final int UNPROCESSABLE = 422;

    @Override
    public Response toResponse(ArchiveSearchException e) {
        log.warnf(e, "Search failed at %s", e.location());
        return ErrorResponse.build(UNPROCESSABLE, "Unprocessable Content", e.getMessage());
    }
}
