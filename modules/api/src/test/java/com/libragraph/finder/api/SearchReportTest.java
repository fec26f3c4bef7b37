package com.libragraph.finder.api;

import com.libragraph.finder.core.search.ArchiveSearchService;
import com.libragraph.finder.core.search.ContentMatcher;
import com.libragraph.finder.core.search.SearchQuery;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

import static org.assertj.core.api.Assertions.*;

class SearchReportTest {

    private static byte[] zip(String... namesAndContents) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (ZipOutputStream zos = new ZipOutputStream(out)) {
            for (int i = 0; i < namesAndContents.length; i += 2) {
                zos.putNextEntry(new ZipEntry(namesAndContents[i]));
                zos.write(namesAndContents[i + 1].getBytes(StandardCharsets.UTF_8));
                zos.closeEntry();
            }
        }
        return out.toByteArray();
    }

    @Test
    void shouldSummarizeWithoutContent() throws IOException {
        byte[] archive = zip("docs/a.txt", "alpha", "b.log", "beta");

        SearchReport report = SearchReport.from(ArchiveSearchService.withDefaults().search(archive,
                SearchQuery.builder()
                        .names("a.txt", "missing")
                        .includeEmpty(true)
                        .matcher(ContentMatcher.of("beta", content -> content.length == 4))
                        .build()));

        assertThat(report.totalMatches()).isEqualTo(2);
        assertThat(report.names()).containsOnlyKeys("a.txt", "missing");
        assertThat(report.names().get("a.txt")).singleElement().satisfies(summary -> {
            assertThat(summary.name()).isEqualTo("docs/a.txt");
            assertThat(summary.location()).isEqualTo("docs/a.txt");
            assertThat(summary.size()).isEqualTo(5);
        });
        assertThat(report.names().get("missing")).isEmpty();
        assertThat(report.matchers().get("beta")).extracting(MatchSummary::name).containsExactly("b.log");
    }
}
