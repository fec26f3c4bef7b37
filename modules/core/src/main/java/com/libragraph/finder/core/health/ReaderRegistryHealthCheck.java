package com.libragraph.finder.core.health;

import com.libragraph.finder.formats.registry.FormatRegistry;
import com.libragraph.finder.types.ArchiveFormat;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Ready once a reader is registered for every container format.
 */
@Readiness
@ApplicationScoped
public class ReaderRegistryHealthCheck implements HealthCheck {

    private FormatRegistry registry;

    @Inject
    public ReaderRegistryHealthCheck(FormatRegistry registry) {
        this.registry = registry;
    }

    @Override
    public HealthCheckResponse call() {
        Set<ArchiveFormat> supported = registry.supportedFormats();
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("formats", supported.stream()
                .map(ArchiveFormat::label)
                .sorted()
                .collect(Collectors.joining(",")));

        HealthCheckResponse.Status status = HealthCheckResponse.Status.UP;
        for (ArchiveFormat format : ArchiveFormat.values()) {
            if (format.isContainer() && !supported.contains(format)) {
                status = HealthCheckResponse.Status.DOWN;
                data.put("missing", format.label());
            }
        }
        return new HealthCheckResponse("archive-readers", status, Optional.of(data));
    }
}
