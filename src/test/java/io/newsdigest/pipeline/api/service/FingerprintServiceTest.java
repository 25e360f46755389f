package io.newsdigest.pipeline.api.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class FingerprintServiceTest {

    private final FingerprintService service = new FingerprintService();

    @Test
    @DisplayName("Should ignore case and whitespace differences")
    void shouldIgnoreCaseAndWhitespace() {
        String a = service.fingerprint("Markets Rally", "Stocks rose\n sharply today.", "Wire");
        String b = service.fingerprint("  markets   rally ", "stocks rose sharply today.", "WIRE");

        assertThat(a).isEqualTo(b).hasSize(64);
    }

    @Test
    @DisplayName("Should differ when the source differs")
    void shouldDifferWhenSourceDiffers() {
        String a = service.fingerprint("Markets Rally", "Stocks rose sharply today.", "Wire");
        String b = service.fingerprint("Markets Rally", "Stocks rose sharply today.", "Other Wire");

        assertThat(a).isNotEqualTo(b);
    }

    @Test
    @DisplayName("Should not collide when text moves between fields")
    void shouldNotCollideAcrossFieldBoundaries() {
        String a = service.fingerprint("Breaking news", "body", "Wire");
        String b = service.fingerprint("Breaking", "news body", "Wire");

        assertThat(a).isNotEqualTo(b);
    }
}
