package io.newsdigest.pipeline.config;

import java.net.URI;
import java.util.List;

public record RssSource(
        String url,
        String name,
        boolean enabled,
        List<String> tags
) {
    public String getSimpleName() {
        if (name != null && !name.isBlank()) return name;

        String host = URI.create(url).getHost();
        return host != null ? host : url;
    }
}
