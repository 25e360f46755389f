package io.newsdigest.pipeline.api.util;

public final class TextExcerpts {

    private TextExcerpts() {
    }

    /**
     * Leading part of {@code text} cut at a word boundary, with an ellipsis when anything was dropped.
     */
    public static String excerpt(String text, int maxLength) {
        if (text == null) return "";

        String normalized = text.replaceAll("\\s+", " ").trim();
        if (normalized.length() <= maxLength) return normalized;

        int cut = normalized.lastIndexOf(' ', maxLength);
        if (cut < maxLength / 2) {
            cut = maxLength;
        }
        return normalized.substring(0, cut).trim() + "...";
    }

    public static String head(String text, int maxChars) {
        if (text == null) return "";
        return text.length() <= maxChars ? text : text.substring(0, maxChars);
    }
}
