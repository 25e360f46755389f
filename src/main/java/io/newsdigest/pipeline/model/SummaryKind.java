package io.newsdigest.pipeline.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;

public enum SummaryKind {
    BRIEF("brief", "brief (2-3 sentences, about 50 words)"),
    COMPREHENSIVE("comprehensive", "comprehensive (about 150-200 words)"),
    ANALYTICAL("analytical", "analytical (about 300 words, focusing on causes, implications and open questions)");

    private final String label;
    private final String instructionProfile;

    SummaryKind(String label, String instructionProfile) {
        this.label = label;
        this.instructionProfile = instructionProfile;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public String instructionProfile() {
        return instructionProfile;
    }

    @JsonCreator
    public static SummaryKind fromLabel(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Summary kind is required");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(kind -> kind.label.equals(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown summary kind: " + value));
    }
}
