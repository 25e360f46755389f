package io.newsdigest.pipeline.api.service;

import io.newsdigest.pipeline.api.dto.ArticleView;
import io.newsdigest.pipeline.api.exception.ArticleNotFoundException;
import io.newsdigest.pipeline.api.exception.ValidationException;
import io.newsdigest.pipeline.model.Article;
import io.newsdigest.pipeline.repository.ArticleRepository;
import io.newsdigest.pipeline.repository.RssFeedRepository;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.HashSet;
import java.util.Set;

@Service
public class ArticleQueryService {

    static final int MAX_PAGE_SIZE = 100;

    private final ArticleRepository articleRepository;
    private final RssFeedRepository feedRepository;

    public ArticleQueryService(ArticleRepository articleRepository, RssFeedRepository feedRepository) {
        this.articleRepository = articleRepository;
        this.feedRepository = feedRepository;
    }

    /**
     * Newest published first; undated articles last. With {@code tagIds}, only articles whose source is the
     * name of a feed carrying any of those tags are listed.
     */
    @Transactional(readOnly = true)
    public Page<ArticleView> list(String source, Collection<Long> tagIds, int page, int size) {
        if (page < 0 || size < 1 || size > MAX_PAGE_SIZE) {
            throw new ValidationException("page must be >= 0 and size between 1 and " + MAX_PAGE_SIZE);
        }

        Sort order = Sort.by(Sort.Order.desc("publishedAt").nullsLast(), Sort.Order.desc("id"));
        Pageable pageable = PageRequest.of(page, size, order);

        boolean bySource = source != null && !source.isBlank();
        if (tagIds != null && !tagIds.isEmpty()) {
            Set<String> feedNames = new HashSet<>(feedRepository.findNamesByTagIdIn(tagIds));
            if (bySource) {
                feedNames.retainAll(Set.of(source.trim()));
            }
            if (feedNames.isEmpty()) {
                return Page.empty(pageable);
            }
            return articleRepository.findBySourceIn(feedNames, pageable).map(ArticleView::of);
        }

        Page<Article> articles = bySource
                ? articleRepository.findBySource(source.trim(), pageable)
                : articleRepository.findAll(pageable);

        return articles.map(ArticleView::of);
    }

    @Transactional(readOnly = true)
    public ArticleView get(long articleId) {
        return articleRepository.findById(articleId)
                .map(ArticleView::of)
                .orElseThrow(() -> new ArticleNotFoundException(articleId));
    }

    @Transactional(readOnly = true)
    public long count() {
        return articleRepository.count();
    }
}
