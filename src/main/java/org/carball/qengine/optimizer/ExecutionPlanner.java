package org.carball.qengine.optimizer;

import org.carball.qengine.model.context.QueryContext;
import org.carball.qengine.model.plan.ExecutionStep;
import org.carball.qengine.model.plan.ParallelizationInfo;
import org.carball.qengine.model.plan.ResourceRequirements;
import org.carball.qengine.model.plan.StepOperation;
import org.carball.qengine.model.query.Aggregation;
import org.carball.qengine.model.query.Join;
import org.carball.qengine.model.query.JoinKind;
import org.carball.qengine.model.query.QueryPattern;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Derives a logical execution plan from a parsed query: ordered steps, groups of steps that
 * can run concurrently and the memory and resource classes the plan needs.
 */
public class ExecutionPlanner {

    private static final double SCAN_COST = 1000;
    private static final double FILTER_COST_PER_CONDITION = 100;
    private static final double JOIN_COST = 2000;
    private static final double AGGREGATION_COST = 500;
    private static final double SORT_COST_PER_COLUMN = 300;
    private static final double LIMIT_COST = 10;

    private static final double BOTTLENECK_COST = 1000;
    private static final double CPU_INTENSIVE_COST = 5000;
    private static final double GIB = 1024.0 * 1024 * 1024;
    private static final double MAX_SCALE = 10;

    /**
     * Steps in execution order. Every step depends on the group of steps emitted just before
     * it: the scans, the filter, the joins and so on.
     */
    public List<ExecutionStep> generateSteps(QueryPattern pattern) {
        List<ExecutionStep> steps = new ArrayList<>();
        List<String> previousGroup = new ArrayList<>();

        List<String> scans = new ArrayList<>();
        for (int i = 0; i < pattern.getTables().size(); i++) {
            String table = pattern.getTables().get(i);
            ExecutionStep scan = step("scan_" + i, StepOperation.TABLE_SCAN, "Scan table " + table,
                    SCAN_COST, previousGroup, true);
            steps.add(scan);
            scans.add(scan.getId());
        }
        previousGroup = scans;

        if (!pattern.getConditions().isEmpty()) {
            steps.add(step("filter", StepOperation.FILTER, "Apply WHERE conditions",
                    pattern.getConditions().size() * FILTER_COST_PER_CONDITION, previousGroup, true));
            previousGroup = List.of("filter");
        }

        if (pattern.hasJoins()) {
            List<String> joins = new ArrayList<>();
            for (int i = 0; i < pattern.getJoins().size(); i++) {
                Join join = pattern.getJoins().get(i);
                ExecutionStep step = step("join_" + i, StepOperation.JOIN,
                        join.getKind() + " JOIN " + join.getLeftTable() + " with " + join.getRightTable(),
                        JOIN_COST, previousGroup, join.getKind() == JoinKind.INNER);
                steps.add(step);
                joins.add(step.getId());
            }
            previousGroup = joins;
        }

        if (pattern.hasAggregations()) {
            boolean decomposable = pattern.getAggregations().stream().allMatch(Aggregation::isDecomposable);
            steps.add(step("aggregate", StepOperation.AGGREGATE, "Apply aggregation functions",
                    pattern.getAggregations().size() * AGGREGATION_COST, previousGroup, decomposable));
            previousGroup = List.of("aggregate");
        }

        if (pattern.hasOrderBy()) {
            String columns = pattern.getOrderBy().stream()
                    .map(o -> o.getColumn() + " " + o.getDirection())
                    .collect(Collectors.joining(", "));
            steps.add(step("sort", StepOperation.SORT, "Sort by " + columns,
                    pattern.getOrderBy().size() * SORT_COST_PER_COLUMN, previousGroup, false));
            previousGroup = List.of("sort");
        }

        if (pattern.hasLimit()) {
            steps.add(step("limit", StepOperation.LIMIT, "Limit to " + pattern.getLimit() + " rows",
                    LIMIT_COST, previousGroup, false));
        }

        return steps;
    }

    /**
     * Greedy grouping: each unvisited parallelizable step collects every later unvisited
     * parallelizable step that has no direct or transitive dependency with any member of its
     * group.
     */
    public ParallelizationInfo analyzeParallelization(List<ExecutionStep> steps) {
        Map<String, Set<String>> ancestors = ancestors(steps);
        List<List<String>> groups = new ArrayList<>();
        Set<String> visited = new HashSet<>();
        int maxDegree = 1;

        for (ExecutionStep step : steps) {
            if (visited.contains(step.getId()) || !step.isCanParallelize()) {
                continue;
            }
            List<ExecutionStep> group = new ArrayList<>();
            group.add(step);
            visited.add(step.getId());

            for (ExecutionStep other : steps) {
                if (visited.contains(other.getId()) || !other.isCanParallelize()) {
                    continue;
                }
                if (group.stream().allMatch(member -> independent(member, other, ancestors))) {
                    group.add(other);
                    visited.add(other.getId());
                }
            }

            if (group.size() > 1) {
                groups.add(group.stream().map(ExecutionStep::getId).collect(Collectors.toList()));
                maxDegree = Math.max(maxDegree, group.size());
            }
        }

        List<String> bottlenecks = steps.stream()
                .filter(s -> !s.isCanParallelize() && s.getEstimatedCost() > BOTTLENECK_COST)
                .map(ExecutionStep::getId)
                .collect(Collectors.toList());

        return ParallelizationInfo.builder()
                .maxDegreeOfParallelism(maxDegree)
                .parallelSteps(groups)
                .bottlenecks(bottlenecks)
                .build();
    }

    /**
     * Memory bounds in megabytes, raised by the heaviest operation present and scaled by the
     * context's data size (one step per GiB, at most ten).
     */
    public ResourceRequirements calculateResourceRequirements(List<ExecutionStep> steps, QueryContext context) {
        boolean hasJoins = hasOperation(steps, StepOperation.JOIN);
        boolean hasAggregations = hasOperation(steps, StepOperation.AGGREGATE);
        boolean hasSort = hasOperation(steps, StepOperation.SORT);
        double totalCost = steps.stream().mapToDouble(ExecutionStep::getEstimatedCost).sum();

        double minMemory = 64;
        double maxMemory = 512;
        if (hasJoins) {
            minMemory = Math.max(minMemory, 128);
            maxMemory = Math.max(maxMemory, 1024);
        }
        if (hasAggregations) {
            minMemory = Math.max(minMemory, 256);
            maxMemory = Math.max(maxMemory, 2048);
        }
        if (hasSort) {
            minMemory = Math.max(minMemory, 512);
            maxMemory = Math.max(maxMemory, 4096);
        }

        if (context != null && context.getDataSize() != null) {
            double scale = Math.min(context.totalSize() / GIB, MAX_SCALE);
            minMemory = Math.floor(minMemory * (1 + scale));
            maxMemory = Math.floor(maxMemory * (1 + scale));
        }

        return ResourceRequirements.builder()
                .minMemory(minMemory)
                .maxMemory(maxMemory)
                .cpuIntensive(hasJoins || hasAggregations || totalCost > CPU_INTENSIVE_COST)
                .ioIntensive(hasOperation(steps, StepOperation.TABLE_SCAN))
                .networkIntensive(hasJoins)
                .build();
    }

    private static boolean independent(ExecutionStep a, ExecutionStep b, Map<String, Set<String>> ancestors) {
        return !ancestors.get(a.getId()).contains(b.getId()) && !ancestors.get(b.getId()).contains(a.getId());
    }

    // steps are in execution order, so every dependency is resolved before its dependents
    private static Map<String, Set<String>> ancestors(List<ExecutionStep> steps) {
        Map<String, Set<String>> ancestors = new HashMap<>();
        for (ExecutionStep step : steps) {
            Set<String> all = new HashSet<>(step.getDependencies());
            for (String dependency : step.getDependencies()) {
                all.addAll(ancestors.getOrDefault(dependency, Set.of()));
            }
            ancestors.put(step.getId(), all);
        }
        return ancestors;
    }

    private static boolean hasOperation(List<ExecutionStep> steps, StepOperation operation) {
        return steps.stream().anyMatch(s -> s.getOperation() == operation);
    }

    private static ExecutionStep step(String id, StepOperation operation, String description, double cost,
                                      List<String> dependencies, boolean canParallelize) {
        return ExecutionStep.builder()
                .id(id)
                .operation(operation)
                .description(description)
                .estimatedCost(cost)
                .dependencies(new ArrayList<>(dependencies))
                .canParallelize(canParallelize)
                .build();
    }
}
