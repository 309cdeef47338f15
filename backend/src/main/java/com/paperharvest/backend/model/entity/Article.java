package com.paperharvest.backend.model.entity;

import com.paperharvest.backend.model.enums.ArticleStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "articles", indexes = {
        @Index(name = "idx_articles_status", columnList = "status"),
        @Index(name = "idx_articles_hash", columnList = "abstractEnHash"),
        @Index(name = "idx_articles_search_url", columnList = "searchUrl")
})
public class Article {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true, length = 2048)
    private String articleUrl;

    @Column(length = 2048)
    private String searchUrl;

    @Column(length = 4096)
    private String title;

    @Column(length = 1024)
    private String journal;

    // Kept as published, sites disagree on date formats
    private String publishedDate;

    @Column(length = 65535)
    private String abstractEn;

    @Column(length = 65535)
    private String abstractZh;

    @Column(length = 64)
    private String abstractEnHash;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private ArticleStatus status;

    @Column(length = 2048)
    private String failureReason;

    private LocalDateTime crawledAt;

    private LocalDateTime translatedAt;

    @CreationTimestamp
    private LocalDateTime createdAt;

    @UpdateTimestamp
    private LocalDateTime updatedAt;
}
