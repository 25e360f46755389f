package io.newsdigest.pipeline.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;

@ConfigurationProperties(prefix = "rss")
public record RssConfig(
        List<RssSource> sources,
        ProcessingConfig processing,
        HttpConfig http
) {

    public List<RssSource> getEnabledSources() {
        if (sources == null) return List.of();

        return sources.stream()
                .filter(RssSource::enabled)
                .toList();
    }
}
