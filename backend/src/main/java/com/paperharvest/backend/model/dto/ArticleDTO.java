package com.paperharvest.backend.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Fields extracted from one article page
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ArticleDTO {
    private String url;
    private String title;
    private String journal;
    private String publishedDate;
    private String abstractEn;
}
