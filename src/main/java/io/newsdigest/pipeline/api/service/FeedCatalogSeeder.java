package io.newsdigest.pipeline.api.service;

import io.newsdigest.pipeline.config.RssConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Component
@Order(1)
public class FeedCatalogSeeder implements ApplicationRunner {

    private static final Logger logger = LoggerFactory.getLogger(FeedCatalogSeeder.class);

    private final FeedCatalogService feedCatalog;
    private final RssConfig rssConfig;

    public FeedCatalogSeeder(FeedCatalogService feedCatalog, RssConfig rssConfig) {
        this.feedCatalog = feedCatalog;
        this.rssConfig = rssConfig;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (rssConfig.sources() == null || rssConfig.sources().isEmpty()) {
            return;
        }

        int added = feedCatalog.seed(rssConfig.sources());
        logger.info("Feed catalog seeded: {} of {} configured sources added", added, rssConfig.sources().size());
    }
}
