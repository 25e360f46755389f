package io.newsdigest.pipeline.repository;

import io.newsdigest.pipeline.api.dto.ArticleFilter;
import io.newsdigest.pipeline.model.Article;
import jakarta.persistence.EntityManager;
import jakarta.persistence.Tuple;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.CriteriaQuery;
import jakarta.persistence.criteria.Predicate;
import jakarta.persistence.criteria.Root;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Resolves an {@link ArticleFilter} to concrete article ids. Preview and delete both go through here,
 * so they always agree on what a filter matches.
 */
@Repository
public class ArticleSelector {

    public record ArticleRef(long id, String source) {}

    private final EntityManager entityManager;

    public ArticleSelector(EntityManager entityManager) {
        this.entityManager = entityManager;
    }

    /**
     * Articles without a published date never match a published-before bound.
     */
    public List<ArticleRef> select(ArticleFilter filter) {
        CriteriaBuilder cb = entityManager.getCriteriaBuilder();
        CriteriaQuery<Tuple> query = cb.createTupleQuery();
        Root<Article> article = query.from(Article.class);

        List<Predicate> predicates = new ArrayList<>();
        if (filter.publishedBefore() != null) {
            predicates.add(cb.lessThan(article.<Instant>get("publishedAt"), filter.publishedBefore()));
        }
        if (!filter.sources().isEmpty()) {
            predicates.add(article.get("source").in(filter.sources()));
        }

        query.multiselect(article.get("id"), article.get("source"))
                .where(predicates.toArray(new Predicate[0]))
                .orderBy(cb.asc(article.get("id")));

        return entityManager.createQuery(query).getResultList().stream()
                .map(tuple -> new ArticleRef(tuple.get(0, Long.class), tuple.get(1, String.class)))
                .toList();
    }
}
