package org.carball.qengine.optimizer;

import org.carball.qengine.model.context.DataSize;
import org.carball.qengine.model.context.QueryContext;
import org.carball.qengine.model.plan.ExecutionStep;
import org.carball.qengine.model.plan.ParallelizationInfo;
import org.carball.qengine.model.plan.ResourceRequirements;
import org.carball.qengine.model.plan.StepOperation;
import org.carball.qengine.model.query.Aggregation;
import org.carball.qengine.model.query.ClauseKind;
import org.carball.qengine.model.query.Condition;
import org.carball.qengine.model.query.Join;
import org.carball.qengine.model.query.JoinKind;
import org.carball.qengine.model.query.OrderBy;
import org.carball.qengine.model.query.QueryKind;
import org.carball.qengine.model.query.QueryPattern;
import org.carball.qengine.model.query.SortDirection;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

public class ExecutionPlannerTest {

    private ExecutionPlanner planner;
    private QueryPattern pattern;

    @BeforeEach
    public void setUp() {
        planner = new ExecutionPlanner();
        pattern = QueryPattern.builder()
                .kind(QueryKind.SELECT)
                .tables(List.of("users", "orders"))
                .conditions(List.of(new Condition("users.active", "=", "1", ClauseKind.WHERE)))
                .joins(List.of(new Join(JoinKind.INNER, "users", "orders", "users.id = orders.user_id")))
                .aggregations(List.of(new Aggregation("COUNT", "orders.id", null)))
                .orderBy(List.of(new OrderBy("users.name", SortDirection.ASC)))
                .limit(5)
                .build();
    }

    @Test
    public void shouldGenerateStepsInExecutionOrder() {
        // When
        List<ExecutionStep> steps = planner.generateSteps(pattern);

        // Then
        assertThat(steps).extracting(ExecutionStep::getId)
                .containsExactly("scan_0", "scan_1", "filter", "join_0", "aggregate", "sort", "limit");
        assertThat(steps).extracting(ExecutionStep::getOperation).containsExactly(
                StepOperation.TABLE_SCAN, StepOperation.TABLE_SCAN, StepOperation.FILTER, StepOperation.JOIN,
                StepOperation.AGGREGATE, StepOperation.SORT, StepOperation.LIMIT);
        assertThat(steps).extracting(ExecutionStep::getEstimatedCost)
                .containsExactly(1000.0, 1000.0, 100.0, 2000.0, 500.0, 300.0, 10.0);
        assertThat(steps.get(2).getDependencies()).containsExactly("scan_0", "scan_1");
        assertThat(steps.get(3).getDependencies()).containsExactly("filter");
        assertThat(steps.get(4).isCanParallelize()).isTrue();
        assertThat(steps.get(5).isCanParallelize()).isFalse();
    }

    @Test
    public void shouldGroupIndependentScans() {
        // Given
        List<ExecutionStep> steps = planner.generateSteps(pattern);

        // When
        ParallelizationInfo info = planner.analyzeParallelization(steps);

        // Then
        assertThat(info.getParallelSteps()).containsExactly(List.of("scan_0", "scan_1"));
        assertThat(info.getMaxDegreeOfParallelism()).isEqualTo(2);
        assertThat(info.getBottlenecks()).isEmpty();
    }

    @Test
    public void shouldReportOuterJoinAsBottleneck() {
        // Given
        QueryPattern outer = pattern.toBuilder()
                .joins(List.of(new Join(JoinKind.LEFT, "users", "orders", "users.id = orders.user_id")))
                .build();

        // When
        ParallelizationInfo info = planner.analyzeParallelization(planner.generateSteps(outer));

        // Then
        assertThat(info.getBottlenecks()).containsExactly("join_0");
    }

    @Test
    public void shouldReportDegreeOneForSingleTable() {
        // Given
        QueryPattern single = QueryPattern.builder().kind(QueryKind.SELECT).tables(List.of("t")).build();

        // When
        ParallelizationInfo info = planner.analyzeParallelization(planner.generateSteps(single));

        // Then
        assertThat(info.getMaxDegreeOfParallelism()).isEqualTo(1);
        assertThat(info.getParallelSteps()).isEmpty();
    }

    @Test
    public void shouldRaiseMemoryForHeaviestOperation() {
        // When
        ResourceRequirements requirements = planner.calculateResourceRequirements(planner.generateSteps(pattern), null);

        // Then
        assertThat(requirements.getMinMemory()).isEqualTo(512);
        assertThat(requirements.getMaxMemory()).isEqualTo(4096);
        assertThat(requirements.isCpuIntensive()).isTrue();
        assertThat(requirements.isIoIntensive()).isTrue();
        assertThat(requirements.isNetworkIntensive()).isTrue();
    }

    @Test
    public void shouldScaleMemoryWithDataSize() {
        // Given
        QueryPattern single = QueryPattern.builder().kind(QueryKind.SELECT).tables(List.of("t")).build();
        QueryContext context = QueryContext.builder()
                .dataSize(DataSize.builder().totalRows(1_000).totalSize(2L * 1024 * 1024 * 1024).build())
                .build();

        // When
        ResourceRequirements requirements = planner.calculateResourceRequirements(planner.generateSteps(single), context);

        // Then
        assertThat(requirements.getMinMemory()).isEqualTo(192);
        assertThat(requirements.getMaxMemory()).isEqualTo(1536);
        assertThat(requirements.isCpuIntensive()).isFalse();
        assertThat(requirements.isNetworkIntensive()).isFalse();
    }
}
