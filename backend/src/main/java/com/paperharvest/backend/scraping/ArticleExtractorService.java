package com.paperharvest.backend.scraping;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.paperharvest.backend.model.dto.ArticleDTO;
import com.paperharvest.backend.util.TextUtils;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.springframework.stereotype.Service;

/**
 * Pulls title, journal, publication date and English abstract out of an article page.
 * JSON-LD is preferred, then citation/meta tags, then an "Abstract" section in the body.
 */
@Service
@Slf4j
public class ArticleExtractorService {

    private static final Set<String> HEADINGS = Set.of("h1", "h2", "h3", "h4");

    private static final List<String> TITLE_META = List.of(
            "meta[name=citation_title]", "meta[property=og:title]", "meta[name=dc.title]");

    private static final List<String> JOURNAL_META = List.of(
            "meta[name=citation_journal_title]", "meta[name=citation_conference_title]",
            "meta[name=citation_inbook_title]", "meta[name=prism.publicationName]");

    private static final List<String> DATE_META = List.of(
            "meta[name=citation_publication_date]", "meta[name=citation_date]",
            "meta[property=article:published_time]", "meta[name=dc.date]");

    private static final List<String> ABSTRACT_META = List.of(
            "meta[name=citation_abstract]", "meta[name=dc.description]",
            "meta[property=og:description]", "meta[name=description]");

    /**
     * @throws ExtractionException when the page carries no abstract
     */
    public ArticleDTO extract(String url, String html) {
        Document doc = Jsoup.parse(html, url);
        JsonObject jsonLd = pickArticleJsonLd(collectJsonLd(doc));

        String title = TextUtils.cleanText(firstNonBlank(
                text(jsonLd, "headline"), text(jsonLd, "name"), meta(doc, TITLE_META), doc.title()));

        String journal = null;
        if (jsonLd != null && jsonLd.has("isPartOf") && jsonLd.get("isPartOf").isJsonObject()) {
            journal = TextUtils.cleanText(text(jsonLd.getAsJsonObject("isPartOf"), "name"));
        }
        if (journal == null) {
            journal = TextUtils.cleanText(meta(doc, JOURNAL_META));
        }

        String publishedDate = TextUtils.cleanText(firstNonBlank(
                text(jsonLd, "datePublished"), text(jsonLd, "dateCreated"), meta(doc, DATE_META)));

        String abstractEn = TextUtils.cleanText(firstNonBlank(text(jsonLd, "abstract"), text(jsonLd, "description")));
        if (abstractEn == null) {
            abstractEn = TextUtils.cleanText(meta(doc, ABSTRACT_META));
        }
        if (abstractEn == null) {
            abstractEn = extractDomAbstract(doc);
        }

        if (abstractEn == null) {
            log.warn("No abstract found on {}", url);
            throw new ExtractionException("No abstract found on " + url);
        }

        log.debug("Extracted {}: title={}, journal={}, date={}, abstract_length={}",
                url, title, journal, publishedDate, abstractEn.length());

        return ArticleDTO.builder()
                .url(url)
                .title(title)
                .journal(journal)
                .publishedDate(publishedDate)
                .abstractEn(abstractEn)
                .build();
    }

    private List<JsonObject> collectJsonLd(Document doc) {
        List<JsonObject> out = new ArrayList<>();
        for (Element script : doc.select("script[type=application/ld+json]")) {
            String raw = script.data().trim();
            if (raw.isEmpty()) continue;
            try {
                collect(out, JsonParser.parseString(raw));
            } catch (JsonParseException e) {
                log.debug("Skipping unparseable JSON-LD block: {}", e.getMessage());
            }
        }
        return out;
    }

    private void collect(List<JsonObject> out, JsonElement element) {
        if (element == null || element.isJsonNull()) return;
        if (element.isJsonArray()) {
            element.getAsJsonArray().forEach(child -> collect(out, child));
        } else if (element.isJsonObject()) {
            JsonObject obj = element.getAsJsonObject();
            if (obj.has("@graph")) {
                collect(out, obj.get("@graph"));
                return;
            }
            out.add(obj);
            collect(out, obj.get("mainEntity"));
            collect(out, obj.get("mainEntityOfPage"));
        }
    }

    private JsonObject pickArticleJsonLd(List<JsonObject> nodes) {
        for (JsonObject node : nodes) {
            JsonElement type = node.get("@type");
            if (type == null || type.isJsonNull()) continue;
            if (type.isJsonArray()) {
                for (JsonElement t : type.getAsJsonArray()) {
                    if (t.isJsonPrimitive() && t.getAsString().contains("Article")) return node;
                }
            } else if (type.isJsonPrimitive() && type.getAsString().contains("Article")) {
                return node;
            }
        }
        return nodes.isEmpty() ? null : nodes.get(0);
    }

    /**
     * Paragraphs following an "Abstract" heading, up to the next heading
     */
    private String extractDomAbstract(Document doc) {
        Element header = null;
        for (Element heading : doc.select("h1, h2, h3, h4")) {
            if (heading.text().toLowerCase().contains("abstract")) {
                header = heading;
                break;
            }
        }
        if (header == null) return null;

        Elements all = doc.getAllElements();
        List<String> parts = new ArrayList<>();
        for (int i = all.indexOf(header) + 1; i < all.size(); i++) {
            Element el = all.get(i);
            if (HEADINGS.contains(el.normalName())) break;
            if ("p".equals(el.normalName())) {
                String text = TextUtils.cleanText(el.text());
                if (text != null) parts.add(text);
            }
        }
        return TextUtils.cleanText(String.join(" ", parts));
    }

    private static String text(JsonObject obj, String field) {
        if (obj == null || !obj.has(field)) return null;
        JsonElement value = obj.get(field);
        if (value.isJsonPrimitive()) return value.getAsString();
        if (value.isJsonArray() && value.getAsJsonArray().size() > 0
                && value.getAsJsonArray().get(0).isJsonPrimitive()) {
            return value.getAsJsonArray().get(0).getAsString();
        }
        return null;
    }

    private static String meta(Document doc, List<String> selectors) {
        for (String selector : selectors) {
            Element el = doc.selectFirst(selector);
            if (el != null && !el.attr("content").isBlank()) {
                return el.attr("content");
            }
        }
        return null;
    }

    private static String firstNonBlank(String... values) {
        for (String v : values) {
            if (!TextUtils.isBlank(v)) return v;
        }
        return null;
    }
}
