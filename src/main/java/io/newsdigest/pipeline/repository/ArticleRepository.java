package io.newsdigest.pipeline.repository;

import io.newsdigest.pipeline.model.Article;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface ArticleRepository extends JpaRepository<Article, Long> {

    boolean existsByFingerprint(String fingerprint);

    Page<Article> findBySource(String source, Pageable pageable);

    Page<Article> findBySourceIn(Collection<String> sources, Pageable pageable);

    @Query("select a.id from Article a where a.id in :ids")
    List<Long> findExistingIds(@Param("ids") Collection<Long> ids);

    @Query("select a.id from Article a order by a.id")
    List<Long> findAllIds();

    @Query("select distinct a.source from Article a order by a.source")
    List<String> findDistinctSources();

    @Modifying
    @Query("delete from Article a where a.id in :ids")
    int deleteByIdIn(@Param("ids") Collection<Long> ids);
}
