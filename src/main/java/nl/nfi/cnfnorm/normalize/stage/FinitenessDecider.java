package nl.nfi.cnfnorm.normalize.stage;

import nl.nfi.cnfnorm.grammar.Grammar;
import nl.nfi.cnfnorm.grammar.NonTerminal;
import nl.nfi.cnfnorm.grammar.Production;
import nl.nfi.cnfnorm.trace.TraceSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

import static java.util.stream.Collectors.joining;
import static nl.nfi.cnfnorm.trace.Stage.FINITENESS;

// the language of a trimmed grammar without epsilon and unit productions is infinite
// iff its dependency graph has a cycle
public final class FinitenessDecider {

    private static final Logger LOG = LoggerFactory.getLogger(FinitenessDecider.class);

    private final TraceSink trace;

    public FinitenessDecider(final TraceSink trace) {
        this.trace = trace;
    }

    public boolean isInfinite(final Grammar grammar) {
        final GrammarEditor editor = new GrammarEditor(FINITENESS, grammar, trace);

        final Map<NonTerminal, Set<NonTerminal>> graph = dependencyGraph(grammar);
        editor.emit("dependency-graph", graph.keySet(), describe(graph));

        final Optional<List<NonTerminal>> cycle = findCycle(graph);
        if (cycle.isPresent()) {
            final String path = cycle.get().stream().map(NonTerminal::toString).collect(joining(" -> "));
            editor.emit("result", cycle.get(), "Language is infinite, cycle: %s".formatted(path));
            LOG.debug("Cycle found: {}", path);
            return true;
        }
        editor.emit("result", List.of(), "Language is finite, the dependency graph is acyclic");
        return false;
    }

    // edge A -> B for every nonterminal B in a body of A, neighbours in alphabetical order
    static Map<NonTerminal, Set<NonTerminal>> dependencyGraph(final Grammar grammar) {
        final Map<NonTerminal, Set<NonTerminal>> graph = new LinkedHashMap<>();
        for (final NonTerminal variable : grammar.sortedVariables()) {
            final Set<NonTerminal> neighbours = new TreeSet<>();
            for (final Production production : grammar.productions(variable)) {
                for (final NonTerminal referenced : production.nonTerminals()) {
                    if (grammar.hasVariable(referenced)) {
                        neighbours.add(referenced);
                    }
                }
            }
            graph.put(variable, Collections.unmodifiableSet(neighbours));
        }
        return Collections.unmodifiableMap(graph);
    }

    // depth-first search with an explicit recursion stack, returns the first cycle found as a closed path
    static Optional<List<NonTerminal>> findCycle(final Map<NonTerminal, Set<NonTerminal>> graph) {
        final Set<NonTerminal> visited = new HashSet<>();

        for (final NonTerminal root : graph.keySet()) {
            if (visited.contains(root)) {
                continue;
            }

            // path and onPath together form the recursion stack
            final List<NonTerminal> path = new ArrayList<>();
            final Set<NonTerminal> onPath = new LinkedHashSet<>();
            final Deque<Iterator<NonTerminal>> pending = new ArrayDeque<>();

            visited.add(root);
            path.add(root);
            onPath.add(root);
            pending.push(graph.get(root).iterator());

            while (!pending.isEmpty()) {
                final Iterator<NonTerminal> neighbours = pending.peek();
                if (!neighbours.hasNext()) {
                    pending.pop();
                    onPath.remove(path.remove(path.size() - 1));
                    continue;
                }

                final NonTerminal next = neighbours.next();
                if (onPath.contains(next)) {
                    final List<NonTerminal> cycle = new ArrayList<>(path.subList(path.indexOf(next), path.size()));
                    cycle.add(next);
                    return Optional.of(cycle);
                }
                if (visited.add(next)) {
                    path.add(next);
                    onPath.add(next);
                    pending.push(graph.getOrDefault(next, Set.of()).iterator());
                }
            }
        }
        return Optional.empty();
    }

    private static String describe(final Map<NonTerminal, Set<NonTerminal>> graph) {
        final StringBuilder description = new StringBuilder("Dependency graph:");
        graph.forEach((variable, neighbours) -> {
            if (!neighbours.isEmpty()) {
                description.append("\n").append(variable).append(" -> ")
                        .append(neighbours.stream().map(NonTerminal::toString).collect(joining(", ")));
            }
        });
        return description.toString();
    }
}
