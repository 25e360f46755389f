package io.newsdigest.pipeline.api.exception;

import java.util.Map;

public class ArticleNotFoundException extends PipelineException {

    public ArticleNotFoundException(long articleId) {
        super("Article with ID " + articleId + " not found", "ARTICLE_NOT_FOUND",
                Map.of("article_id", articleId), null);
    }
}
