package nl.nfi.cnfnorm.grammar;

import nl.nfi.cnfnorm.serialize.GrammarFormatter;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import static java.util.Collections.unmodifiableMap;

// immutable grammar: a start symbol and, per nonterminal, an ordered set of productions
// a nonterminal is a key of the rule table iff it has at least one production
// edits copy the variable map but share the production lists of untouched variables
public final class Grammar {

    private final NonTerminal startSymbol;
    private final Map<NonTerminal, List<Production>> rules;

    private Grammar(final NonTerminal startSymbol, final Map<NonTerminal, List<Production>> rules) {
        this.startSymbol = startSymbol;
        this.rules = unmodifiableMap(rules);
    }

    public static Grammar empty(final NonTerminal startSymbol) {
        return new Grammar(Objects.requireNonNull(startSymbol), new LinkedHashMap<>());
    }

    // rejects rules without productions and references to undeclared nonterminals
    public static Grammar of(final NonTerminal startSymbol, final Map<NonTerminal, ? extends Collection<Production>> rules) {
        if (startSymbol == null) {
            throw new MalformedGrammarException("Grammar requires a start symbol");
        }
        final Map<NonTerminal, List<Production>> copy = new LinkedHashMap<>();
        for (final Map.Entry<NonTerminal, ? extends Collection<Production>> entry : rules.entrySet()) {
            if (entry.getValue().isEmpty()) {
                throw new MalformedGrammarException("No productions declared for %s".formatted(entry.getKey()));
            }
            // set semantics, first occurrence wins
            copy.put(entry.getKey(), List.copyOf(new LinkedHashSet<>(entry.getValue())));
        }
        final Grammar grammar = new Grammar(startSymbol, copy);
        grammar.validate();
        return grammar;
    }

    public NonTerminal startSymbol() {
        return startSymbol;
    }

    public Set<NonTerminal> variables() {
        return rules.keySet();
    }

    // alphabetical by name, the iteration order of every transformation
    public List<NonTerminal> sortedVariables() {
        final List<NonTerminal> variables = new ArrayList<>(rules.keySet());
        Collections.sort(variables);
        return variables;
    }

    public boolean hasVariable(final NonTerminal variable) {
        return rules.containsKey(variable);
    }

    public List<Production> productions(final NonTerminal variable) {
        final List<Production> productions = rules.get(variable);
        if (productions == null) {
            throw new IllegalStateException("No productions found for " + variable);
        }
        return productions;
    }

    public boolean hasProduction(final NonTerminal variable, final Production production) {
        final List<Production> productions = rules.get(variable);
        return productions != null && productions.contains(production);
    }

    public List<Rule> rules() {
        final List<Rule> flattened = new ArrayList<>();
        rules.forEach((lhs, productions) -> productions.forEach(body -> flattened.add(Rule.of(lhs, body))));
        return flattened;
    }

    public int productionCount() {
        return rules.values().stream().mapToInt(List::size).sum();
    }

    public boolean isEmpty() {
        return rules.isEmpty();
    }

    public Set<NonTerminal> referencedNonTerminals() {
        final Set<NonTerminal> referenced = new LinkedHashSet<>();
        for (final List<Production> productions : rules.values()) {
            for (final Production production : productions) {
                referenced.addAll(production.nonTerminals());
            }
        }
        return referenced;
    }

    public void validate() {
        for (final Map.Entry<NonTerminal, List<Production>> entry : rules.entrySet()) {
            for (final Production production : entry.getValue()) {
                for (final NonTerminal referenced : production.nonTerminals()) {
                    if (!rules.containsKey(referenced)) {
                        throw new MalformedGrammarException("Production %s -> %s references undeclared nonterminal %s"
                                .formatted(entry.getKey(), production, referenced));
                    }
                }
            }
        }
    }

    public Grammar withStartSymbol(final NonTerminal startSymbol) {
        if (this.startSymbol.equals(startSymbol)) {
            return this;
        }
        return new Grammar(startSymbol, new LinkedHashMap<>(rules));
    }

    // appends the production, or returns this grammar when it is already present
    public Grammar withProduction(final NonTerminal variable, final Production production) {
        final List<Production> current = rules.getOrDefault(variable, List.of());
        if (current.contains(production)) {
            return this;
        }
        final List<Production> updated = new ArrayList<>(current.size() + 1);
        updated.addAll(current);
        updated.add(production);

        final Map<NonTerminal, List<Production>> copy = new LinkedHashMap<>(rules);
        copy.put(variable, Collections.unmodifiableList(updated));
        return new Grammar(startSymbol, copy);
    }

    // removes the production, dropping the variable once it has none left
    public Grammar withoutProduction(final NonTerminal variable, final Production production) {
        final List<Production> current = rules.get(variable);
        if (current == null || !current.contains(production)) {
            return this;
        }
        final Map<NonTerminal, List<Production>> copy = new LinkedHashMap<>(rules);
        if (current.size() == 1) {
            copy.remove(variable);
        } else {
            final List<Production> updated = new ArrayList<>(current);
            updated.remove(production);
            copy.put(variable, Collections.unmodifiableList(updated));
        }
        return new Grammar(startSymbol, copy);
    }

    @Override
    public boolean equals(final Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Grammar grammar)) {
            return false;
        }
        return startSymbol.equals(grammar.startSymbol)
                && rules.equals(grammar.rules)
                && new ArrayList<>(rules.keySet()).equals(new ArrayList<>(grammar.rules.keySet()));
    }

    @Override
    public int hashCode() {
        return Objects.hash(startSymbol, rules);
    }

    @Override
    public String toString() {
        return GrammarFormatter.format(this);
    }
}
