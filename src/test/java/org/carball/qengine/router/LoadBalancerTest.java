package org.carball.qengine.router;

import org.carball.qengine.model.routing.LoadBalancingStrategy;
import org.carball.qengine.model.routing.RouteCandidate;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class LoadBalancerTest {

    @Test
    public void shouldFollowWeightsWithSmoothWeightedRoundRobin() {
        // Given
        LoadBalancer balancer = new LoadBalancer(LoadBalancingStrategy.WEIGHTED);
        List<RouteCandidate> pool = List.of(candidate("a", 3.0, 0, 0), candidate("b", 1.0, 0, 0));

        // When
        List<String> picks = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            picks.add(balancer.select(pool, "SELECT 1", i).getConnectionId());
        }

        // Then
        assertThat(picks).containsExactly("a", "a", "b", "a", "a", "a", "b", "a");
    }

    @Test
    public void shouldPickLeastLoadedCandidate() {
        // Given
        LoadBalancer balancer = new LoadBalancer(LoadBalancingStrategy.LEAST_CONNECTIONS);
        List<RouteCandidate> pool = List.of(candidate("busy", 1.0, 0.9, 90), candidate("idle", 1.0, 0.1, 60));

        // Then
        assertThat(balancer.select(pool, "SELECT 1", 0).getConnectionId()).isEqualTo("idle");
    }

    @Test
    public void shouldSendSameQueryToSameCandidateWithHash() {
        // Given
        LoadBalancer balancer = new LoadBalancer(LoadBalancingStrategy.HASH);
        List<RouteCandidate> pool = List.of(candidate("a", 1.0, 0, 0), candidate("b", 1.0, 0, 0),
                candidate("c", 1.0, 0, 0));

        // When
        String first = balancer.select(pool, "SELECT * FROM users", 0).getConnectionId();
        String second = balancer.select(pool, "select *   from users", 7).getConnectionId();

        // Then
        assertThat(second).isEqualTo(first);
    }

    @Test
    public void shouldRejectEmptyPool() {
        LoadBalancer balancer = new LoadBalancer(LoadBalancingStrategy.ADAPTIVE);

        assertThatThrownBy(() -> balancer.select(List.of(), "SELECT 1", 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static RouteCandidate candidate(String id, double weight, double load, double score) {
        return RouteCandidate.builder()
                .connectionId(id)
                .weight(weight)
                .load(load)
                .score(score)
                .health(1.0)
                .build();
    }
}
