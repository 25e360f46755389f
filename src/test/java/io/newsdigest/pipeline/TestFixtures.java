package io.newsdigest.pipeline;

import io.newsdigest.pipeline.config.HttpConfig;
import io.newsdigest.pipeline.config.ProcessingConfig;
import io.newsdigest.pipeline.config.RssConfig;
import io.newsdigest.pipeline.model.Article;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

public final class TestFixtures {

    private TestFixtures() {
    }

    public static RssConfig rssConfig() {
        return rssConfig(null, Duration.ofSeconds(5), Duration.ofSeconds(20));
    }

    public static RssConfig rssConfig(Integer maxArticlesPerRun, Duration feedTimeout, Duration runTimeout) {
        ProcessingConfig processing = new ProcessingConfig(
                Duration.ofMinutes(30),
                Duration.ofMinutes(1),
                false,
                4,
                2,
                feedTimeout,
                runTimeout,
                maxArticlesPerRun,
                50,
                50,
                50_000
        );
        HttpConfig http = new HttpConfig(2000, 3000, 1, 10, List.of("TestAgent"));

        return new RssConfig(List.of(), processing, http);
    }

    public static String item(String title, String link, String description) {
        return """
                <item>
                    <title>%s</title>
                    <link>%s</link>
                    <description>%s</description>
                    <pubDate>Mon, 06 Jan 2025 10:00:00 GMT</pubDate>
                </item>
                """.formatted(title, link, description);
    }

    /**
     * RSS 2.0 document with {@code count} distinct, valid items whose text depends on {@code prefix}.
     */
    public static String rss(String prefix, int count) {
        StringBuilder items = new StringBuilder();
        for (int i = 1; i <= count; i++) {
            items.append(item(
                    prefix + " headline " + i,
                    "https://news.example.com/" + prefix + "/" + i,
                    "Full report number " + i + " from " + prefix + " about the ongoing story, with enough words to pass validation."));
        }
        return rss(items.toString());
    }

    public static String rss(String items) {
        return """
                <?xml version="1.0" encoding="UTF-8"?>
                <rss version="2.0">
                    <channel>
                        <title>Example Channel</title>
                        <link>https://news.example.com</link>
                        <description>Test feed</description>
                        %s
                    </channel>
                </rss>
                """.formatted(items);
    }

    public static String longText(String seed) {
        return (seed + " ").repeat(30).trim();
    }

    /**
     * Unsaved article; the fingerprint only has to be unique.
     */
    public static Article article(String title, String source, Instant publishedAt) {
        return new Article(title, longText(title + " body"), source, publishedAt,
                "https://news.example.com/" + title.toLowerCase().replace(' ', '-'), Map.of(),
                Integer.toHexString((title + "|" + source).hashCode()) + "-" + System.nanoTime());
    }

    /**
     * Article carrying an id as if it had been loaded from the store.
     */
    public static Article article(long id, String title, String source, Instant publishedAt) {
        Article article = article(title, source, publishedAt);
        ReflectionTestUtils.setField(article, "id", id);
        return article;
    }
}
