package io.newsdigest.pipeline.repository;

import io.newsdigest.pipeline.model.ReadingListItem;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface ReadingListRepository extends JpaRepository<ReadingListItem, Long> {

    Optional<ReadingListItem> findByArticleId(Long articleId);

    boolean existsByArticleId(Long articleId);

    List<ReadingListItem> findAllByOrderByAddedAtDesc();

    @Modifying
    @Query("delete from ReadingListItem r where r.articleId in :articleIds")
    int deleteByArticleIdIn(@Param("articleIds") Collection<Long> articleIds);
}
