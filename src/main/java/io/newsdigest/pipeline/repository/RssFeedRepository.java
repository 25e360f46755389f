package io.newsdigest.pipeline.repository;

import io.newsdigest.pipeline.model.RssFeed;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface RssFeedRepository extends JpaRepository<RssFeed, Long> {

    List<RssFeed> findByEnabledTrueOrderByIdAsc();

    boolean existsByUrl(String url);

    @Query("select distinct f from RssFeed f join f.tags t where t.id = :tagId")
    List<RssFeed> findByTagId(@Param("tagId") long tagId);

    @Query("select distinct f.name from RssFeed f join f.tags t where t.id in :tagIds")
    List<String> findNamesByTagIdIn(@Param("tagIds") Collection<Long> tagIds);
}
