package com.artifactguard.core.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScanStrategyTest {

    @Test
    void extractAndArchiveAreMutuallyExclusive() {
        assertThatThrownBy(() -> new ScanStrategy.FilesystemScan(true, true, "x"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void blankReasonRejected() {
        assertThatThrownBy(() -> new ScanStrategy.Skip(" ")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ScanStrategy.ImageScan(null)).isInstanceOf(NullPointerException.class);
    }

    @Test
    void skipIsNotScannable() {
        ScanStrategy skip = new ScanStrategy.Skip("checksum");
        assertThat(skip).isNotInstanceOf(ScanStrategy.Scannable.class);
        assertThat(skip.skip()).isTrue();
        assertThat(new ScanStrategy.ConfigScan("cfg").skip()).isFalse();
    }

    @Test
    void hierarchyIsSkipOrScannable() {
        assertThat(ScanStrategy.class.getPermittedSubclasses())
                .containsExactlyInAnyOrder(ScanStrategy.Skip.class, ScanStrategy.Scannable.class);
        assertThat(ScanStrategy.Scannable.class.getPermittedSubclasses())
                .containsExactlyInAnyOrder(ScanStrategy.FilesystemScan.class, ScanStrategy.ImageScan.class,
                        ScanStrategy.ConfigScan.class);
    }

    @Test
    void severityParsingIsLenient() {
        assertThat(Severity.parse(" high ")).isEqualTo(Severity.HIGH);
        assertThat(Severity.parse("")).isEqualTo(Severity.UNKNOWN);
        assertThat(Severity.parse("bogus")).isEqualTo(Severity.UNKNOWN);
    }
}
