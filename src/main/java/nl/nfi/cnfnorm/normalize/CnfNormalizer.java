package nl.nfi.cnfnorm.normalize;

import nl.nfi.cnfnorm.common.Timers;
import nl.nfi.cnfnorm.common.Timers.TimedResult;
import nl.nfi.cnfnorm.grammar.Grammar;
import nl.nfi.cnfnorm.grammar.NonTerminal;
import nl.nfi.cnfnorm.grammar.Production;
import nl.nfi.cnfnorm.grammar.Rule;
import nl.nfi.cnfnorm.normalize.stage.BinaryCascader;
import nl.nfi.cnfnorm.normalize.stage.EpsilonEliminator;
import nl.nfi.cnfnorm.normalize.stage.FinitenessDecider;
import nl.nfi.cnfnorm.normalize.stage.ProductivityAnalyzer;
import nl.nfi.cnfnorm.normalize.stage.TerminalIsolator;
import nl.nfi.cnfnorm.normalize.stage.UnitProductionEliminator;
import nl.nfi.cnfnorm.normalize.stage.VariableAllocator;
import nl.nfi.cnfnorm.trace.LoggingTraceSink;
import nl.nfi.cnfnorm.trace.Stage;
import nl.nfi.cnfnorm.trace.TraceSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;

import static nl.nfi.cnfnorm.normalize.NormalizationDefectException.Defect.CNF_VIOLATED;
import static nl.nfi.cnfnorm.trace.Stage.BINARY;
import static nl.nfi.cnfnorm.trace.Stage.EPSILON;
import static nl.nfi.cnfnorm.trace.Stage.PRODUCTIVITY;
import static nl.nfi.cnfnorm.trace.Stage.TERMINAL;
import static nl.nfi.cnfnorm.trace.Stage.UNIT;

/**
 * Normalizes a context-free grammar into Chomsky Normal Form and decides emptiness and finiteness of
 * its language on the way.
 * <p>
 * Stages run strictly in order, and the pipeline stops after trimming when the language is empty.
 * Every call to {@link #normalize(Grammar)} uses its own allocator, so one instance can serve
 * independent runs concurrently.
 */
public final class CnfNormalizer {

    private static final Logger LOG = LoggerFactory.getLogger(CnfNormalizer.class);

    private final NormalizerConfig config;
    private final TraceSink trace;

    private CnfNormalizer(final NormalizerConfig config, final TraceSink trace) {
        this.config = config;
        this.trace = trace;
    }

    public static CnfNormalizer create() {
        return new CnfNormalizer(NormalizerConfig.defaults(), TraceSink.noop());
    }

    public CnfNormalizer config(final NormalizerConfig config) {
        return new CnfNormalizer(config, trace);
    }

    public CnfNormalizer trace(final TraceSink trace) {
        return new CnfNormalizer(config, trace);
    }

    public NormalizerConfig config() {
        return config;
    }

    public NormalizationResult normalize(final Grammar grammar) {
        grammar.validate();
        LOG.info("Normalizing grammar: start symbol {}, {} variables, {} productions",
                grammar.startSymbol(), grammar.variables().size(), grammar.productionCount());

        final TraceSink sink = trace.andThen(new LoggingTraceSink());
        final VariableAllocator allocator = config.newAllocator();
        allocator.reserve(grammar.startSymbol());
        allocator.reserveAll(grammar.variables());

        final TimedResult<ProductivityAnalyzer.Result> trimmed = Timers.time(() -> new ProductivityAnalyzer(sink).analyze(grammar));
        logStage(PRODUCTIVITY, trimmed.value().grammar(), trimmed);
        if (trimmed.value().languageEmpty()) {
            LOG.info("Language is empty, skipping remaining stages");
            return NormalizationResult.emptyLanguage(trimmed.value().grammar());
        }

        Grammar current = trimmed.value().grammar();
        current = runStage(EPSILON, current, new EpsilonEliminator(config.newStartSymbol(), sink)::apply);
        current = runStage(UNIT, current, new UnitProductionEliminator(sink)::apply);
        current = runStage(TERMINAL, current, new TerminalIsolator(allocator, sink)::apply);
        current = runStage(BINARY, current, new BinaryCascader(allocator, config.reuseCascades(), sink)::apply);

        final List<Rule> violations = cnfViolations(current);
        if (!violations.isEmpty()) {
            throw new NormalizationDefectException(CNF_VIOLATED, "Productions not in CNF: %s".formatted(violations));
        }

        final Grammar cnf = current;
        final TimedResult<Boolean> infinite = Timers.time(() -> new FinitenessDecider(sink).isInfinite(cnf));
        LOG.info("Stage {} done in {} ms: language is {}", Stage.FINITENESS.key(), infinite.millis(),
                infinite.value() ? "infinite" : "finite");

        return new NormalizationResult(cnf, false, infinite.value());
    }

    // allowed: X -> YZ with neither Y nor Z the start symbol, X -> a, and S -> ε for the start symbol only
    public static List<Rule> cnfViolations(final Grammar grammar) {
        final NonTerminal start = grammar.startSymbol();
        final List<Rule> violations = new ArrayList<>();
        for (final Rule rule : grammar.rules()) {
            final Production body = rule.body();
            final boolean valid;
            if (body.isEpsilon()) {
                valid = rule.lhs().equals(start);
            } else if (body.length() == 1) {
                valid = body.isSingleTerminal();
            } else {
                valid = body.length() == 2
                        && body.symbols().stream().allMatch(symbol -> symbol.isNonTerminal() && !symbol.equals(start));
            }
            if (!valid) {
                violations.add(rule);
            }
        }
        return violations;
    }

    private static Grammar runStage(final Stage stage, final Grammar input, final UnaryOperator<Grammar> transformation) {
        final TimedResult<Grammar> result = Timers.time(() -> transformation.apply(input));
        logStage(stage, result.value(), result);
        return result.value();
    }

    private static void logStage(final Stage stage, final Grammar output, final TimedResult<?> timing) {
        LOG.info("Stage {} done in {} ms: {} variables, {} productions",
                stage.key(), timing.millis(), output.variables().size(), output.productionCount());
    }
}
