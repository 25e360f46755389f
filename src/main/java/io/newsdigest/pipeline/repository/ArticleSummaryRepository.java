package io.newsdigest.pipeline.repository;

import io.newsdigest.pipeline.model.ArticleSummary;
import io.newsdigest.pipeline.model.SummaryKind;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface ArticleSummaryRepository extends JpaRepository<ArticleSummary, Long> {

    Optional<ArticleSummary> findByArticleIdAndSummaryType(Long articleId, SummaryKind summaryType);

    List<ArticleSummary> findByArticleIdOrderByGeneratedAtDesc(Long articleId);

    long countByArticleId(Long articleId);

    @Modifying
    @Query("delete from ArticleSummary s where s.articleId in :articleIds")
    int deleteByArticleIdIn(@Param("articleIds") Collection<Long> articleIds);

    @Modifying
    @Query("delete from ArticleSummary s where s.articleId = :articleId and s.summaryType = :kind")
    int deleteByArticleIdAndKind(@Param("articleId") Long articleId, @Param("kind") SummaryKind kind);
}
