package org.carball.qengine.router;

import org.carball.qengine.model.routing.LoadBalancingStrategy;
import org.carball.qengine.model.routing.RouteCandidate;
import org.carball.qengine.util.QueryText;

import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Picks one candidate from a non-empty pool. Only the weighted strategy keeps state: the
 * running weights of a smooth weighted round-robin, so picks follow the learned weights
 * without randomness.
 */
public class LoadBalancer {

    private static final double MIN_WEIGHT = 0.01;

    private final LoadBalancingStrategy strategy;
    private final Map<String, Double> currentWeights = new HashMap<>();

    public LoadBalancer(LoadBalancingStrategy strategy) {
        this.strategy = strategy;
    }

    public LoadBalancingStrategy getStrategy() {
        return strategy;
    }

    public RouteCandidate select(List<RouteCandidate> pool, String query, long requestNumber) {
        if (pool.isEmpty()) {
            throw new IllegalArgumentException("Cannot balance over an empty pool");
        }
        return switch (strategy) {
            case ROUND_ROBIN -> pool.get((int) Math.floorMod(requestNumber, (long) pool.size()));
            case LEAST_CONNECTIONS -> pool.stream().min(Comparator.comparingDouble(RouteCandidate::getLoad)).orElseThrow();
            case WEIGHTED -> selectWeighted(pool);
            case HASH -> pool.get(QueryText.bucket(query, pool.size()));
            case ADAPTIVE -> pool.stream().max(Comparator.comparingDouble(RouteCandidate::getScore)).orElseThrow();
        };
    }

    private synchronized RouteCandidate selectWeighted(List<RouteCandidate> pool) {
        double total = 0;
        RouteCandidate best = null;
        double bestWeight = Double.NEGATIVE_INFINITY;

        for (RouteCandidate candidate : pool) {
            double weight = Math.max(candidate.getWeight(), MIN_WEIGHT);
            total += weight;
            double current = currentWeights.merge(candidate.getConnectionId(), weight, Double::sum);
            if (current > bestWeight) {
                bestWeight = current;
                best = candidate;
            }
        }

        currentWeights.merge(best.getConnectionId(), -total, Double::sum);
        return best;
    }

    synchronized void forget(String connectionId) {
        currentWeights.remove(connectionId);
    }
}
