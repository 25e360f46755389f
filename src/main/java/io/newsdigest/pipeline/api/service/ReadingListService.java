package io.newsdigest.pipeline.api.service;

import io.newsdigest.pipeline.api.dto.ReadingListEntryView;
import io.newsdigest.pipeline.api.exception.ArticleNotFoundException;
import io.newsdigest.pipeline.api.exception.PipelineException;
import io.newsdigest.pipeline.model.Article;
import io.newsdigest.pipeline.model.ReadingListItem;
import io.newsdigest.pipeline.repository.ArticleRepository;
import io.newsdigest.pipeline.repository.ReadingListRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
public class ReadingListService {

    private final ReadingListRepository readingListRepository;
    private final ArticleRepository articleRepository;

    public ReadingListService(ReadingListRepository readingListRepository, ArticleRepository articleRepository) {
        this.readingListRepository = readingListRepository;
        this.articleRepository = articleRepository;
    }

    /**
     * Adding an article that is already listed returns the existing entry unchanged.
     */
    @Transactional
    public ReadingListEntryView add(long articleId, String notes) {
        Article article = article(articleId);

        Optional<ReadingListItem> existing = readingListRepository.findByArticleId(articleId);
        if (existing.isPresent()) {
            return ReadingListEntryView.of(existing.get(), article, false);
        }

        ReadingListItem saved = readingListRepository.saveAndFlush(new ReadingListItem(articleId, notes));
        return ReadingListEntryView.of(saved, article, true);
    }

    /**
     * @return false when the article was not on the list
     */
    @Transactional
    public boolean remove(long articleId) {
        return readingListRepository.deleteByArticleIdIn(List.of(articleId)) > 0;
    }

    @Transactional
    public ReadingListEntryView updateNotes(long articleId, String notes) {
        Article article = article(articleId);
        ReadingListItem item = readingListRepository.findByArticleId(articleId)
                .orElseThrow(() -> new PipelineException("Article " + articleId + " is not on the reading list",
                        "READING_LIST_ENTRY_NOT_FOUND", Map.of("article_id", articleId), null));

        item.setNotes(notes);
        return ReadingListEntryView.of(item, article, false);
    }

    @Transactional(readOnly = true)
    public boolean contains(long articleId) {
        return readingListRepository.existsByArticleId(articleId);
    }

    /**
     * @return entries newest first; entries whose article is gone are left out
     */
    @Transactional(readOnly = true)
    public List<ReadingListEntryView> list() {
        List<ReadingListItem> items = readingListRepository.findAllByOrderByAddedAtDesc();
        Map<Long, Article> articles = articleRepository.findAllById(items.stream().map(ReadingListItem::getArticleId).toList())
                .stream()
                .collect(Collectors.toMap(Article::getId, Function.identity()));

        return items.stream()
                .filter(item -> articles.containsKey(item.getArticleId()))
                .map(item -> ReadingListEntryView.of(item, articles.get(item.getArticleId()), false))
                .toList();
    }

    private Article article(long articleId) {
        return articleRepository.findById(articleId).orElseThrow(() -> new ArticleNotFoundException(articleId));
    }
}
