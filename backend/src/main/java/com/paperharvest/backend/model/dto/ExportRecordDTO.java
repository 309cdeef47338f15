package com.paperharvest.backend.model.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.paperharvest.backend.model.entity.Article;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Flat record written by the exporter
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({"article_url", "title", "journal", "published_date", "abstract_en", "abstract_zh"})
public class ExportRecordDTO {
    @JsonProperty("article_url")
    private String articleUrl;
    @JsonProperty("title")
    private String title;
    @JsonProperty("journal")
    private String journal;
    @JsonProperty("published_date")
    private String publishedDate;
    @JsonProperty("abstract_en")
    private String abstractEn;
    @JsonProperty("abstract_zh")
    private String abstractZh;

    public static ExportRecordDTO from(Article article) {
        return new ExportRecordDTO(
                article.getArticleUrl(),
                article.getTitle(),
                article.getJournal(),
                article.getPublishedDate(),
                article.getAbstractEn(),
                article.getAbstractZh());
    }
}
