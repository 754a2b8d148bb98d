package com.williamcallahan.contextaggregator.application.context;

import com.williamcallahan.contextaggregator.domain.context.AggregatorConfig.BudgetSettings;
import com.williamcallahan.contextaggregator.domain.context.AggregatorConfig.TaskRouting;
import com.williamcallahan.contextaggregator.domain.context.ContextSourceType;
import com.williamcallahan.contextaggregator.domain.context.TaskType;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Splits a token budget across sources in proportion to priority weights.
 *
 * <p>Stateless apart from the settings it was built with. Shares are floored and the rounding
 * remainder stays unallocated, so the allocation total never exceeds the budget.</p>
 */
public class BudgetManager {

    private static final List<ContextSourceType> FALLBACK_SOURCES =
            List.of(ContextSourceType.VECTOR_DB, ContextSourceType.RAG);
    private static final int DEFAULT_WEIGHT = 1;

    private final BudgetSettings budgetSettings;
    private final Map<TaskType, TaskRouting> taskRouting;

    /**
     * Creates a budget manager for one configuration snapshot.
     *
     * @param budgetSettings budget defaults and allocation floor
     * @param taskRouting default sources and weights per task type
     */
    public BudgetManager(BudgetSettings budgetSettings, Map<TaskType, TaskRouting> taskRouting) {
        this.budgetSettings = Objects.requireNonNull(budgetSettings, "budgetSettings");
        this.taskRouting = taskRouting == null ? Map.of() : Map.copyOf(taskRouting);
    }

    /**
     * Computes {@code max(0, maxTokens - reserved)}.
     *
     * @param maxTokens request ceiling
     * @param reservedTokens request reservation, or null for the configured default
     * @return effective budget, never negative
     */
    public int effectiveBudget(int maxTokens, Integer reservedTokens) {
        int reserved = reservedTokens == null ? budgetSettings.reservedTokens() : reservedTokens;
        return Math.max(0, maxTokens - reserved);
    }

    /**
     * Allocates {@code floor(totalBudget * weight / sum(weights))} to each source.
     *
     * <p>Sources missing from {@code priorities} weigh 1. When every weight is zero or negative the
     * budget is split equally. When {@code minChunkTokens * sources <= totalBudget}, sources below the
     * floor are raised to it and the shortfall is taken from the largest allocations.</p>
     *
     * @param sources sources to allocate across, in request order
     * @param priorities per-source weights
     * @param totalBudget effective budget
     * @return per-source allocation in source order; empty when there is nothing to allocate
     */
    public Map<ContextSourceType, Integer> allocate(
            Collection<ContextSourceType> sources, Map<ContextSourceType, Integer> priorities, int totalBudget) {
        if (sources == null || sources.isEmpty() || totalBudget <= 0) {
            return Map.of();
        }
        List<ContextSourceType> orderedSources = List.copyOf(new LinkedHashSet<>(sources));
        Map<ContextSourceType, Integer> weights = priorities == null ? Map.of() : priorities;

        long weightSum = 0;
        for (ContextSourceType source : orderedSources) {
            weightSum += Math.max(0, weights.getOrDefault(source, DEFAULT_WEIGHT));
        }

        Map<ContextSourceType, Integer> allocation = new LinkedHashMap<>();
        for (ContextSourceType source : orderedSources) {
            long share;
            if (weightSum == 0) {
                share = totalBudget / orderedSources.size();
            } else {
                long weight = Math.max(0, weights.getOrDefault(source, DEFAULT_WEIGHT));
                share = totalBudget * weight / weightSum;
            }
            allocation.put(source, (int) share);
        }

        applyMinimumFloor(allocation, orderedSources, totalBudget);
        return allocation;
    }

    private void applyMinimumFloor(
            Map<ContextSourceType, Integer> allocation, List<ContextSourceType> orderedSources, int totalBudget) {
        int floor = budgetSettings.minChunkTokens();
        if (floor <= 0 || (long) floor * orderedSources.size() > totalBudget) {
            return;
        }

        int shortfall = 0;
        for (ContextSourceType source : orderedSources) {
            int current = allocation.get(source);
            if (current < floor) {
                shortfall += floor - current;
                allocation.put(source, floor);
            }
        }
        if (shortfall == 0) {
            return;
        }

        List<ContextSourceType> largestFirst = new ArrayList<>(orderedSources);
        largestFirst.sort(Comparator.comparing((ContextSourceType source) -> allocation.get(source)).reversed());
        for (ContextSourceType source : largestFirst) {
            if (shortfall == 0) {
                break;
            }
            int current = allocation.get(source);
            int taken = Math.min(shortfall, current - floor);
            if (taken > 0) {
                allocation.put(source, current - taken);
                shortfall -= taken;
            }
        }
    }

    /**
     * Redistributes the allocation of failed sources across succeeding ones in proportion to what they
     * used. Failed sources end at 0; when every source failed the original map is returned.
     *
     * @param original allocation made before fan-out
     * @param used tokens each source actually used
     * @param failed sources that returned an error
     * @return adjusted allocation whose total never exceeds the original total
     */
    public Map<ContextSourceType, Integer> reallocateUnused(
            Map<ContextSourceType, Integer> original,
            Map<ContextSourceType, Integer> used,
            Set<ContextSourceType> failed) {
        List<ContextSourceType> succeeded = original.keySet().stream()
                .filter(source -> !failed.contains(source))
                .toList();
        if (succeeded.isEmpty()) {
            return Map.copyOf(original);
        }

        int freed = 0;
        for (ContextSourceType source : original.keySet()) {
            if (failed.contains(source)) {
                freed += original.get(source);
            }
        }
        long usedTotal = 0;
        for (ContextSourceType source : succeeded) {
            usedTotal += Math.max(0, used.getOrDefault(source, 0));
        }

        Map<ContextSourceType, Integer> adjusted = new LinkedHashMap<>();
        for (ContextSourceType source : original.keySet()) {
            if (failed.contains(source)) {
                adjusted.put(source, 0);
                continue;
            }
            long bonus = usedTotal == 0
                    ? freed / succeeded.size()
                    : freed * Math.max(0, used.getOrDefault(source, 0)) / usedTotal;
            adjusted.put(source, original.get(source) + (int) bonus);
        }
        return adjusted;
    }

    /**
     * Returns the sources queried for a task type when the request names none.
     *
     * @param taskType task type, may be null
     * @return mutable copy of the default source list
     */
    public List<ContextSourceType> defaultSources(TaskType taskType) {
        TaskRouting routing = taskType == null ? null : taskRouting.get(taskType);
        if (routing == null || routing.sources().isEmpty()) {
            return new ArrayList<>(FALLBACK_SOURCES);
        }
        return new ArrayList<>(routing.sources());
    }

    /**
     * Returns the default priority weights for a task type.
     *
     * @param taskType task type, may be null
     * @return mutable copy of the weights
     */
    public Map<ContextSourceType, Integer> defaultPriorities(TaskType taskType) {
        Map<ContextSourceType, Integer> copy = new EnumMap<>(ContextSourceType.class);
        TaskRouting routing = taskType == null ? null : taskRouting.get(taskType);
        if (routing == null) {
            FALLBACK_SOURCES.forEach(source -> copy.put(source, DEFAULT_WEIGHT));
            return copy;
        }
        copy.putAll(routing.priorities());
        return copy;
    }

    public BudgetSettings settings() {
        return budgetSettings;
    }
}
