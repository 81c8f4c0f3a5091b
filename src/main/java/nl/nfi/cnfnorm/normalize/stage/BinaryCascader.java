package nl.nfi.cnfnorm.normalize.stage;

import nl.nfi.cnfnorm.grammar.Grammar;
import nl.nfi.cnfnorm.grammar.NonTerminal;
import nl.nfi.cnfnorm.grammar.Production;
import nl.nfi.cnfnorm.trace.TraceSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static nl.nfi.cnfnorm.trace.Stage.BINARY;

// splits A -> X1 X2 ... Xm (m >= 3) into the chain:
//      A -> X1 H1, H1 -> X2 H2, ..., H(m-2) -> X(m-1) Xm
// a body seen before under any left-hand side reuses its chain
public final class BinaryCascader {

    private static final Logger LOG = LoggerFactory.getLogger(BinaryCascader.class);

    private final VariableAllocator allocator;
    private final boolean reuseCascades;
    private final TraceSink trace;

    public BinaryCascader(final VariableAllocator allocator, final boolean reuseCascades, final TraceSink trace) {
        this.allocator = allocator;
        this.reuseCascades = reuseCascades;
        this.trace = trace;
    }

    public Grammar apply(final Grammar grammar) {
        final GrammarEditor editor = new GrammarEditor(BINARY, grammar, trace);
        allocator.reserveAll(grammar.variables());

        final Map<Production, List<NonTerminal>> cascades = new HashMap<>();
        int reused = 0;

        for (final NonTerminal variable : grammar.sortedVariables()) {
            for (final Production production : new ArrayList<>(grammar.productions(variable))) {
                final int length = production.length();
                if (length < 3) {
                    continue;
                }

                List<NonTerminal> helpers = reuseCascades ? cascades.get(production) : null;
                final boolean fresh = helpers == null;
                if (fresh) {
                    helpers = new ArrayList<>(length - 2);
                    for (int i = 0; i < length - 2; i++) {
                        helpers.add(allocator.allocate());
                    }
                    cascades.put(production, List.copyOf(helpers));

                    for (int i = 0; i < length - 3; i++) {
                        editor.add(helpers.get(i), Production.of(production.symbolAt(i + 1), helpers.get(i + 1)));
                    }
                    editor.add(helpers.get(length - 3), Production.of(production.symbolAt(length - 2), production.symbolAt(length - 1)));
                } else {
                    reused++;
                }

                editor.remove(variable, production);
                editor.add(variable, Production.of(production.symbolAt(0), helpers.get(0)));

                final List<NonTerminal> affected = new ArrayList<>();
                affected.add(variable);
                affected.addAll(helpers);
                editor.emit(fresh ? "cascade" : "reuse-cascade", affected, "Split %s -> %s (%d symbols) using %s helpers %s"
                        .formatted(variable, production, length, fresh ? "new" : "existing", helpers));
            }
        }

        LOG.debug("Cascaded {} distinct bodies, reused {} chains", cascades.size(), reused);
        return editor.grammar();
    }
}
