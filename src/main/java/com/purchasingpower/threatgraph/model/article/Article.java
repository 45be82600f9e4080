package com.purchasingpower.threatgraph.model.article;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * A security-news article together with the entities already extracted from it.
 *
 * Produced by the ingestion pipeline; the graph only reads the identifying fields and
 * entity lists, and appends to {@code relatedArticleIds} when similarity edges are added.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Article {

    private String id;

    private String title;

    private String url;

    private OffsetDateTime publishedAt;

    @Builder.Default
    private List<String> categories = new ArrayList<>();

    @Builder.Default
    private List<String> vulnerabilities = new ArrayList<>();

    @Builder.Default
    private List<String> threatActors = new ArrayList<>();

    @Builder.Default
    private List<String> relatedArticleIds = new ArrayList<>();
}
