package com.libragraph.finder.api;

import com.libragraph.finder.core.search.ArchiveSearchService;
import com.libragraph.finder.core.search.ContentMatcher;
import com.libragraph.finder.core.search.SearchQuery;
import com.libragraph.finder.core.search.SearchResult;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import org.jboss.logging.Logger;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Searches an uploaded archive. Content matching is limited to UTF-8 substrings,
 * each registered under the key {@code contains:<text>}.
 */
@Path("/api/search")
@Consumes(MediaType.APPLICATION_OCTET_STREAM)
@Produces(MediaType.APPLICATION_JSON)
public class SearchResource {

    private static final Logger log = Logger.getLogger(SearchResource.class);

    static final String CONTAINS_PREFIX = "contains:";

    @Inject
    ArchiveSearchService searchService;

    @POST
    public SearchReport search(
            byte[] archive,
            @QueryParam("name") List<String> names,
            @QueryParam("contains") List<String> contains,
            @QueryParam("caseSensitive") @DefaultValue("true") boolean caseSensitive,
            @QueryParam("firstOnly") @DefaultValue("false") boolean firstOnly,
            @QueryParam("includeEmpty") @DefaultValue("false") boolean includeEmpty,
            @QueryParam("recursive") @DefaultValue("false") boolean recursive,
            @QueryParam("maxDepth") Integer maxDepth) {

        SearchQuery.Builder query = SearchQuery.builder()
                .names(names != null ? names : List.of())
                .caseSensitive(caseSensitive)
                .firstOnly(firstOnly)
                .includeEmpty(includeEmpty)
                .recursive(recursive);
        if (contains != null) {
            for (String text : contains) {
                query.matcher(containsMatcher(text));
            }
        }
        if (maxDepth != null) {
            query.maxDepth(maxDepth);
        }
        SearchQuery built = query.build();

        byte[] body = archive != null ? archive : new byte[0];
        log.debugf("Search request: %d bytes, names=%s, contains=%s", body.length, names, contains);
        SearchResult result = searchService.search(body, built);
        return SearchReport.from(result);
    }

    static ContentMatcher<Boolean> containsMatcher(String text) {
        byte[] needle = text.getBytes(StandardCharsets.UTF_8);
        return ContentMatcher.of(CONTAINS_PREFIX + text, content -> indexOf(content, needle) >= 0);
    }

    static int indexOf(byte[] haystack, byte[] needle) {
        outer:
        for (int i = 0; i <= haystack.length - needle.length; i++) {
            for (int j = 0; j < needle.length; j++) {
                if (haystack[i + j] != needle[j]) {
                    continue outer;
                }
            }
            return i;
        }
        return -1;
    }
}
