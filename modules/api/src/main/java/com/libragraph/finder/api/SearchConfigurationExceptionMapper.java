package com.libragraph.finder.api;

import com.libragraph.finder.core.search.SearchConfigurationException;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.jboss.logging.Logger;

@Provider
public class SearchConfigurationExceptionMapper implements ExceptionMapper<SearchConfigurationException> {

    private static final Logger log = Logger.getLogger(SearchConfigurationExceptionMapper.class);

    @Override
    public Response toResponse(SearchConfigurationException e) {
        log.debugf("Rejected search request: %s", e.getMessage());
        return ErrorResponse.build(Response.Status.BAD_REQUEST, e.getMessage());
    }
}
