package com.libragraph.finder.core.health;

import com.libragraph.finder.formats.handlers.ZipReaderFactory;
import com.libragraph.finder.formats.registry.FormatDetector;
import com.libragraph.finder.formats.registry.FormatRegistry;
import com.libragraph.finder.formats.tika.MediaTypeHint;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class ReaderRegistryHealthCheckTest {

    @Test
    void shouldBeUpWithAllReaders() {
        HealthCheckResponse response = new ReaderRegistryHealthCheck(FormatRegistry.defaults()).call();

        assertThat(response.getStatus()).isEqualTo(HealthCheckResponse.Status.UP);
        assertThat(response.getData()).hasValueSatisfying(data ->
                assertThat(data).containsEntry("formats", "7z,zip"));
    }

    @Test
    void shouldBeDownWhenReaderMissing() {
        FormatRegistry zipOnly = new FormatRegistry(
                new FormatDetector(new MediaTypeHint()), List.of(new ZipReaderFactory()));

        HealthCheckResponse response = new ReaderRegistryHealthCheck(zipOnly).call();

        assertThat(response.getStatus()).isEqualTo(HealthCheckResponse.Status.DOWN);
        assertThat(response.getData()).hasValueSatisfying(data ->
                assertThat(data).containsEntry("missing", "7z"));
    }
}
