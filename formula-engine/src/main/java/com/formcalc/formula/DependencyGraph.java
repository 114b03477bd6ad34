package com.formcalc.formula;

import com.formcalc.util.LoggingUtil;

import java.util.*;

/**
 * Dependency graph of the calculated fields of one entity.
 * An edge {@code a -> b} means the formula of {@code a} reads the calculated field {@code b}.
 * References to non-calculated fields are leaves supplied by the snapshot and are not part of the graph.
 */
public class DependencyGraph {

    private enum Color { WHITE, GRAY, BLACK }

    private final SortedMap<String, SortedSet<String>> dependencies;

    private DependencyGraph(SortedMap<String, SortedSet<String>> dependencies) {
        this.dependencies = dependencies;
    }

    public static DependencyGraph build(Map<String, FormulaNode> calculatedFields) {
        Map<String, Set<String>> references = new LinkedHashMap<>();
        for (Map.Entry<String, FormulaNode> entry : calculatedFields.entrySet()) {
            references.put(entry.getKey(), ReferenceExtractor.extract(entry.getValue()));
        }
        return fromReferences(references);
    }

    /**
     * Graph from the names each calculated field references; names that are not keys of the map are dropped.
     */
    public static DependencyGraph fromReferences(Map<String, ? extends Set<String>> references) {
        SortedMap<String, SortedSet<String>> deps = new TreeMap<>();
        for (Map.Entry<String, ? extends Set<String>> entry : references.entrySet()) {
            SortedSet<String> refVars = new TreeSet<>();
            for (String ref : entry.getValue()) {
                if (references.containsKey(ref)) {
                    refVars.add(ref);
                }
            }
            deps.put(entry.getKey(), refVars);
        }
        return new DependencyGraph(deps);
    }

    public Set<String> getFields() {
        return Collections.unmodifiableSet(dependencies.keySet());
    }

    /**
     * Calculated fields the given field reads directly.
     */
    public SortedSet<String> dependenciesOf(String field) {
        return Collections.unmodifiableSortedSet(dependencies.getOrDefault(field, new TreeSet<>()));
    }

    /**
     * Calculated fields that read the given field directly.
     */
    public SortedSet<String> dependentsOf(String field) {
        SortedSet<String> dependents = new TreeSet<>();
        for (Map.Entry<String, SortedSet<String>> entry : dependencies.entrySet()) {
            if (entry.getValue().contains(field)) {
                dependents.add(entry.getKey());
            }
        }
        return Collections.unmodifiableSortedSet(dependents);
    }

    /**
     * Order in which the fields can be evaluated so that every field comes after the
     * calculated fields it reads. Ties are broken by ascending field id.
     *
     * @return the order, or a CIRCULAR_DEPENDENCY failure naming the fields of the first cycle found
     */
    public Outcome<List<String>> evaluationOrder() {
        Optional<List<String>> cycle = findFirstCycle();
        if (cycle.isPresent()) {
            CycleReport report = new CycleReport(cycle.get());
            LoggingUtil.warn("Circular dependency detected: " + report.getPath());
            return Outcome.failure(FormulaError.forFields(ErrorKind.CIRCULAR_DEPENDENCY,
                    "Circular dependency detected: " + report.getPath(), report.getFields()));
        }

        Map<String, Integer> remaining = new HashMap<>();
        Map<String, List<String>> dependents = new HashMap<>();
        for (Map.Entry<String, SortedSet<String>> entry : dependencies.entrySet()) {
            remaining.put(entry.getKey(), entry.getValue().size());
            for (String dep : entry.getValue()) {
                dependents.computeIfAbsent(dep, k -> new ArrayList<>()).add(entry.getKey());
            }
        }

        PriorityQueue<String> ready = new PriorityQueue<>();
        for (Map.Entry<String, Integer> entry : remaining.entrySet()) {
            if (entry.getValue() == 0) {
                ready.add(entry.getKey());
            }
        }

        List<String> sorted = new ArrayList<>();
        while (!ready.isEmpty()) {
            String field = ready.poll();
            sorted.add(field);
            for (String dependent : dependents.getOrDefault(field, List.of())) {
                int left = remaining.merge(dependent, -1, Integer::sum);
                if (left == 0) {
                    ready.add(dependent);
                }
            }
        }

        LoggingUtil.debug("Evaluation order: " + sorted);
        return Outcome.success(Collections.unmodifiableList(sorted));
    }

    /**
     * Every distinct cycle reached by a depth-first search from each field in ascending order,
     * sorted by path.
     */
    public List<CycleReport> findAllCycles() {
        Map<String, Color> colors = new HashMap<>();
        Deque<String> path = new ArrayDeque<>();
        Set<CycleReport> cycles = new LinkedHashSet<>();

        for (String field : dependencies.keySet()) {
            if (colors.getOrDefault(field, Color.WHITE) == Color.WHITE) {
                visitAll(field, colors, path, cycles);
            }
        }

        List<CycleReport> sorted = new ArrayList<>(cycles);
        sorted.sort(Comparator.comparing(CycleReport::getPath));
        return sorted;
    }

    public boolean hasCycles() {
        return findFirstCycle().isPresent();
    }

    private Optional<List<String>> findFirstCycle() {
        Map<String, Color> colors = new HashMap<>();
        Deque<String> path = new ArrayDeque<>();

        for (String field : dependencies.keySet()) {
            if (colors.getOrDefault(field, Color.WHITE) == Color.WHITE) {
                List<String> cycle = visit(field, colors, path);
                if (cycle != null) {
                    return Optional.of(cycle);
                }
            }
        }
        return Optional.empty();
    }

    private List<String> visit(String node, Map<String, Color> colors, Deque<String> path) {
        colors.put(node, Color.GRAY);
        path.addLast(node);

        for (String dep : dependencies.get(node)) {
            Color color = colors.getOrDefault(dep, Color.WHITE);
            if (color == Color.GRAY) {
                return cycleFrom(dep, path);
            }
            if (color == Color.WHITE) {
                List<String> cycle = visit(dep, colors, path);
                if (cycle != null) {
                    return cycle;
                }
            }
        }

        path.removeLast();
        colors.put(node, Color.BLACK);
        return null;
    }

    private void visitAll(String node, Map<String, Color> colors, Deque<String> path, Set<CycleReport> cycles) {
        colors.put(node, Color.GRAY);
        path.addLast(node);

        for (String dep : dependencies.get(node)) {
            Color color = colors.getOrDefault(dep, Color.WHITE);
            if (color == Color.GRAY) {
                cycles.add(new CycleReport(normalize(cycleFrom(dep, path))));
            } else if (color == Color.WHITE) {
                visitAll(dep, colors, path, cycles);
            }
        }

        path.removeLast();
        colors.put(node, Color.BLACK);
    }

    private static List<String> cycleFrom(String start, Deque<String> path) {
        List<String> members = new ArrayList<>(path);
        return new ArrayList<>(members.subList(members.indexOf(start), members.size()));
    }

    // rotate so the smallest id comes first, the same cycle then always reads the same
    private static List<String> normalize(List<String> cycle) {
        int minIdx = cycle.indexOf(Collections.min(cycle));
        List<String> rotated = new ArrayList<>(cycle.subList(minIdx, cycle.size()));
        rotated.addAll(cycle.subList(0, minIdx));
        return rotated;
    }
}
