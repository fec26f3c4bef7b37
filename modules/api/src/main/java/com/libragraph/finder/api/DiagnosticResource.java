package com.libragraph.finder.api;

import com.libragraph.finder.formats.registry.FormatRegistry;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.util.List;
import java.util.Map;

@Path("/api/diagnostic")
@Produces(MediaType.APPLICATION_JSON)
public class DiagnosticResource {

    @ConfigProperty(name = "quarkus.application.name")
    String appName;

    @ConfigProperty(name = "quarkus.application.version")
    String appVersion;

    @ConfigProperty(name = "quarkus.profile", defaultValue = "prod")
    String profile;

    @Inject
    FormatRegistry registry;

    @GET
    @Path("/ping")
    public Map<String, String> ping() {
        return Map.of(
                "status", "ok",
                "message", "Finder is running"
        );
    }

    @GET
    @Path("/info")
    public Map<String, String> info() {
        return Map.of(
                "name", appName,
                "version", appVersion,
                "java", System.getProperty("java.version"),
                "profile", profile
        );
    }

    /** Formats with a registered reader, e.g. {@code [{"label":"zip","mimeType":"application/zip"}]}. */
    @GET
    @Path("/formats")
    public List<Map<String, String>> formats() {
        return registry.supportedFormats().stream()
                .map(format -> Map.of("label", format.label(), "mimeType", format.mimeType()))
                .toList();
    }
}
