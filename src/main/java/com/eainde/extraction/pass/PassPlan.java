package com.eainde.extraction.pass;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Passes in one linear execution order derived from their dependency graph.
 *
 * <p>The order is a topological sort that is stable with respect to declaration
 * order: among passes whose dependencies are satisfied, the one declared first
 * runs first. Duplicate names, unknown dependencies and cycles are rejected with
 * {@link IllegalArgumentException} when the plan is built.</p>
 */
public final class PassPlan {

    private final List<ExtractionPass> ordered;
    private final Map<String, Integer> positions;

    private PassPlan(List<ExtractionPass> ordered) {
        this.ordered = List.copyOf(ordered);
        Map<String, Integer> positions = new HashMap<>();
        for (int i = 0; i < ordered.size(); i++) positions.put(ordered.get(i).name(), i);
        this.positions = Map.copyOf(positions);
    }

    public static PassPlan of(List<ExtractionPass> passes) {
        Map<String, ExtractionPass> byName = new LinkedHashMap<>();
        for (ExtractionPass pass : passes) {
            if (byName.put(pass.name(), pass) != null) {
                throw new IllegalArgumentException("Duplicate pass name '" + pass.name() + "'");
            }
        }
        for (ExtractionPass pass : passes) {
            for (String dependency : pass.dependsOn()) {
                if (!byName.containsKey(dependency)) {
                    throw new IllegalArgumentException(
                            "Pass '" + pass.name() + "' depends on unknown pass '" + dependency + "'");
                }
            }
        }

        List<ExtractionPass> ordered = new ArrayList<>(passes.size());
        Set<String> placed = new HashSet<>();
        List<ExtractionPass> remaining = new ArrayList<>(byName.values());
        while (!remaining.isEmpty()) {
            ExtractionPass next = null;
            for (ExtractionPass candidate : remaining) {
                if (placed.containsAll(candidate.dependsOn())) {
                    next = candidate;
                    break;
                }
            }
            if (next == null) {
                throw new IllegalArgumentException("Pass dependencies form a cycle among " +
                        remaining.stream().map(ExtractionPass::name).collect(Collectors.joining(", ")));
            }
            ordered.add(next);
            placed.add(next.name());
            remaining.remove(next);
        }
        return new PassPlan(ordered);
    }

    public List<ExtractionPass> passes() {
        return ordered;
    }

    public List<String> names() {
        return ordered.stream().map(ExtractionPass::name).toList();
    }

    public int size() {
        return ordered.size();
    }

    public boolean isEmpty() {
        return ordered.isEmpty();
    }

    /**
     * @return execution position of the pass, or -1 when not in the plan
     */
    public int positionOf(String passName) {
        return positions.getOrDefault(passName, -1);
    }

    public ExtractionPass get(String passName) {
        Integer position = positions.get(passName);
        if (position == null) throw new IllegalArgumentException("Unknown pass '" + passName + "'");
        return ordered.get(position);
    }

    /**
     * Plan with only the passes matching {@code keep}, in the same order. Dependencies on
     * dropped passes are removed, so a kept pass runs with whatever context remains.
     */
    public PassPlan retain(Predicate<ExtractionPass> keep) {
        List<ExtractionPass> kept = new ArrayList<>();
        Set<String> keptNames = new HashSet<>();
        for (ExtractionPass pass : ordered) {
            if (keep.test(pass)) keptNames.add(pass.name());
        }
        for (ExtractionPass pass : ordered) {
            if (!keptNames.contains(pass.name())) continue;
            List<String> dependencies = pass.dependsOn().stream().filter(keptNames::contains).toList();
            kept.add(dependencies.size() == pass.dependsOn().size() ? pass : pass.withDependsOn(dependencies));
        }
        return new PassPlan(kept);
    }

    @Override
    public String toString() {
        return "PassPlan" + names();
    }
}
