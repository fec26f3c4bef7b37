package com.libragraph.finder.formats.api;

import com.libragraph.finder.types.ArchiveFormat;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

class DetectionCriteriaTest {

    @Test
    void shouldMatchEveryZipSignature() {
        assertThat(DetectionCriteria.ZIP.matches(new byte[]{0x50, 0x4B, 0x03, 0x04, 0x14, 0x00})).isTrue();
        assertThat(DetectionCriteria.ZIP.matches(new byte[]{0x50, 0x4B, 0x05, 0x06})).isTrue();
        assertThat(DetectionCriteria.ZIP.matches(new byte[]{0x50, 0x4B, 0x07, 0x08, 0x00})).isTrue();
    }

    @Test
    void shouldNotMatchPartialZipSignature() {
        assertThat(DetectionCriteria.ZIP.matches(new byte[]{0x50, 0x4B, 0x01, 0x02})).isFalse();
        assertThat(DetectionCriteria.ZIP.matches(new byte[]{0x50, 0x4B})).isFalse();
    }

    @Test
    void shouldMatchSevenZipSignature() {
        byte[] header = {'7', 'z', (byte) 0xBC, (byte) 0xAF, 0x27, 0x1C, 0x00, 0x04};

        assertThat(DetectionCriteria.SEVEN_ZIP.matches(header)).isTrue();
        assertThat(DetectionCriteria.ZIP.matches(header)).isFalse();
    }

    @Test
    void shouldNotMatchNullOrEmptyHeader() {
        assertThat(DetectionCriteria.ZIP.matches(null)).isFalse();
        assertThat(DetectionCriteria.ZIP.matches(new byte[0])).isFalse();
    }

    @Test
    void shouldRequireASignature() {
        assertThatIllegalArgumentException()
                .isThrownBy(() -> new DetectionCriteria(ArchiveFormat.ZIP, Set.of(), List.of()));
    }

    @Test
    void signaturesAreCopiedOnConstruction() {
        byte[] magic = {1, 2, 3};
        var criteria = new DetectionCriteria(ArchiveFormat.ZIP, Set.of(), List.of(magic));

        magic[0] = 9;

        assertThat(criteria.matches(new byte[]{1, 2, 3})).isTrue();
    }

    @Test
    void mimeTypesAreAdvisoryOnly() {
        assertThat(DetectionCriteria.ZIP.expectsMimeType("application/zip")).isTrue();
        assertThat(DetectionCriteria.ZIP.matches("application/zip".getBytes())).isFalse();
    }

    @Test
    void shouldResolveCriteriaByFormat() {
        assertThat(DetectionCriteria.forFormat(ArchiveFormat.SEVEN_ZIP)).isSameAs(DetectionCriteria.SEVEN_ZIP);
        assertThatIllegalArgumentException()
                .isThrownBy(() -> DetectionCriteria.forFormat(ArchiveFormat.UNKNOWN));
    }
}
