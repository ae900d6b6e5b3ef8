package org.carball.qengine.router;

import org.carball.qengine.model.context.CachePreference;
import org.carball.qengine.model.context.QueryContext;
import org.carball.qengine.model.query.QueryKind;
import org.carball.qengine.model.routing.ConnectionHealth;
import org.carball.qengine.model.routing.NodeRole;
import org.carball.qengine.model.routing.RouteCandidate;

/**
 * Scores route candidates on a 0-100 scale.
 */
public class CandidateScorer {

    // Factor 1: health
    private static final double HEALTH_WEIGHT = 0.4;
    // Factor 2: inverse load
    private static final double LOAD_WEIGHT = 0.3;
    // Factor 3: inverse latency, saturating at one second
    private static final double LATENCY_WEIGHT = 0.2;
    // Factor 4: free capacity
    private static final double CAPACITY_WEIGHT = 0.1;

    private static final double COMPOSITE_SCALE = 80;
    private static final double ROLE_MATCH_BONUS = 20;
    private static final double ERROR_RATE_PENALTY = 30;

    private CandidateScorer() {
        // Utility class - prevent instantiation
    }

    /**
     * Weighted blend of health, load, latency and utilisation in [0, 1].
     */
    public static double composite(RouteCandidate candidate, ConnectionHealth health) {
        double latency = Math.min(candidate.getLatency() / 1000, 1);
        return candidate.getHealth() * HEALTH_WEIGHT
                + (1 - candidate.getLoad()) * LOAD_WEIGHT
                + (1 - latency) * LATENCY_WEIGHT
                + (1 - utilization(candidate, health)) * CAPACITY_WEIGHT;
    }

    public static double score(RouteCandidate candidate, ConnectionHealth health, String query, QueryContext context) {
        double score = composite(candidate, health) * COMPOSITE_SCALE;
        if (matchesRole(candidate, query, context)) {
            score += ROLE_MATCH_BONUS;
        }
        if (health != null) {
            score -= health.getErrorRate() * ERROR_RATE_PENALTY;
        }
        return Math.max(0, Math.min(100, score));
    }

    static boolean matchesRole(RouteCandidate candidate, String query, QueryContext context) {
        NodeRole role = candidate.role();
        QueryKind kind = QueryKind.fromLeadingVerb(query);
        if (kind.isRead() && (role == NodeRole.ANALYTICS || role == NodeRole.SECONDARY)) {
            return true;
        }
        if (kind.isWrite() && role == NodeRole.PRIMARY) {
            return true;
        }
        CachePreference preference = context != null ? context.cachePreference() : CachePreference.CONSERVATIVE;
        return role == NodeRole.CACHE && preference != CachePreference.DISABLED;
    }

    private static double utilization(RouteCandidate candidate, ConnectionHealth health) {
        if (health == null || health.getDetails() == null || candidate.getCapacity() <= 0) {
            return 0;
        }
        return Math.min((double) health.getDetails().getActiveConnections() / candidate.getCapacity(), 1);
    }
}
