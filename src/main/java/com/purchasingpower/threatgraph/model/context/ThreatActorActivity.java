package com.purchasingpower.threatgraph.model.context;

/**
 * How many articles mention a threat actor, and whether that indicates an active campaign.
 */
public record ThreatActorActivity(String actor, int articleCount, boolean activeCampaigns) {
}
