package com.purchasingpower.threatgraph.configuration;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.validation.annotation.Validated;

/**
 * Knowledge graph settings, bound from the {@code app.graph} namespace in application.yml.
 *
 * <pre>
 * app:
 *   graph:
 *     default-subgraph-depth: 2
 *     max-subgraph-depth: 5
 *     max-paths: 3
 *     context:
 *       connection-density-normalizer: 10.0
 *       trending-threshold: 2
 *       active-campaign-threshold: 1
 *     persistence:
 *       async: true
 * </pre>
 *
 * Defaults reproduce the fixed constants the prediction subsystem was calibrated against.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "app.graph")
public class GraphProperties {

    @Min(1)
    @Max(5)
    private int defaultSubgraphDepth = 2;

    /**
     * Upper bound on subgraph depth. Expansion cost grows as (average degree)^depth.
     */
    @Min(1)
    @Max(5)
    private int maxSubgraphDepth = 5;

    @Min(1)
    private int maxPaths = 3;

    /**
     * Article titles longer than this are truncated (with "...") to form the node label.
     */
    @Min(1)
    private int labelMaxLength = 50;

    @Min(1)
    private int loadNodeLimit = 50_000;

    @Min(1)
    private int loadEdgeLimit = 200_000;

    private boolean loadOnStartup = true;

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private Context context = new Context();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private Persistence persistence = new Persistence();

    @Data
    public static class Context {

        @DecimalMin(value = "0.0", inclusive = false)
        private double connectionDensityNormalizer = 10.0;

        /**
         * A CVE is trending when strictly more articles than this mention it.
         */
        @Min(0)
        private int trendingThreshold = 2;

        /**
         * An actor has active campaigns when strictly more articles than this mention it.
         */
        @Min(0)
        private int activeCampaignThreshold = 1;
    }

    @Data
    public static class Persistence {

        /**
         * Mirror writes on a background thread. When false, writes run on the caller's thread.
         */
        private boolean async = true;

        @Min(1)
        private int queueCapacity = 10_000;
    }
}
