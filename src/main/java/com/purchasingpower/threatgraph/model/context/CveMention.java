package com.purchasingpower.threatgraph.model.context;

/**
 * How many articles mention a CVE, and whether that crosses the trending threshold.
 */
public record CveMention(String cve, int articleCount, boolean trending) {
}
