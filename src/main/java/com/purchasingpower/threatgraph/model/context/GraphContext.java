package com.purchasingpower.threatgraph.model.context;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Graph-derived signals for one article, handed to the prediction subsystem to adjust
 * forecast confidence.
 *
 * The engine attaches no meaning to these values. When {@code hasGraphData} is false every
 * other field is empty or zero and must be read as "no signal".
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GraphContext {

    private boolean hasGraphData;

    private int connectionCount;

    // min(1.0, connectionCount / normalizer)
    private double connectionDensity;

    @Builder.Default
    private List<String> relatedCves = new ArrayList<>();

    @Builder.Default
    private List<String> relatedThreatActors = new ArrayList<>();

    @Builder.Default
    private List<RelatedArticle> relatedArticles = new ArrayList<>();

    @Builder.Default
    private List<ThreatActorActivity> threatActorHistory = new ArrayList<>();

    @Builder.Default
    private List<CveMention> cveSeverityContext = new ArrayList<>();

    public static GraphContext noData() {
        return GraphContext.builder().hasGraphData(false).build();
    }
}
