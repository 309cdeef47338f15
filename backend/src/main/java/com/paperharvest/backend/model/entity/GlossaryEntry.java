package com.paperharvest.backend.model.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;

/**
 * Persisted glossary term, reloaded at the start of every translate run
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "glossary_terms")
public class GlossaryEntry {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true, length = 512)
    private String normalizedTerm;

    @Column(nullable = false, length = 512)
    private String sourceTerm;

    @Column(nullable = false, length = 512)
    private String rendering;

    @Column(length = 2048)
    private String firstArticleUrl;

    @CreationTimestamp
    private LocalDateTime createdAt;
}
