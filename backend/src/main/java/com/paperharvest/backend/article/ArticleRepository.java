package com.paperharvest.backend.article;

import com.paperharvest.backend.model.entity.Article;
import com.paperharvest.backend.model.enums.ArticleStatus;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface ArticleRepository extends JpaRepository<Article, Long> {

    Optional<Article> findByArticleUrl(String articleUrl);

    // Blank abstracts are stored as null
    boolean existsByArticleUrlAndAbstractEnIsNotNull(String articleUrl);

    // Translation queue, oldest first
    @Query("SELECT a FROM Article a WHERE a.status IN :statuses AND a.abstractEn IS NOT NULL AND a.abstractEn <> '' ORDER BY a.id ASC")
    List<Article> findPending(@Param("statuses") Collection<ArticleStatus> statuses, Pageable pageable);

    @Query("SELECT a.abstractZh FROM Article a WHERE a.abstractEnHash = :hash AND a.status = :status AND a.abstractZh IS NOT NULL AND a.abstractZh <> '' ORDER BY a.id ASC")
    List<String> findTranslationsByHash(@Param("hash") String hash, @Param("status") ArticleStatus status, Pageable pageable);

    List<Article> findAllByOrderByIdAsc();

    List<Article> findBySearchUrlOrderByIdAsc(String searchUrl);

    Page<Article> findByStatus(ArticleStatus status, Pageable pageable);

    long countByStatus(ArticleStatus status);
}
