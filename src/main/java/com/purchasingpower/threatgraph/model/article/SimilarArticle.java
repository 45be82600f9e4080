package com.purchasingpower.threatgraph.model.article;

/**
 * A similarity assertion computed upstream: {@code article} resembles the subject article
 * with the given score in [0, 1].
 */
public record SimilarArticle(Article article, double similarity) {
}
