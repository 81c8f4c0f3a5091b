package nl.nfi.cnfnorm.serialize;

import nl.nfi.cnfnorm.grammar.Grammar;
import nl.nfi.cnfnorm.grammar.MalformedGrammarException;
import nl.nfi.cnfnorm.grammar.NonTerminal;
import nl.nfi.cnfnorm.grammar.Rule;
import nl.nfi.cnfnorm.trace.GrammarDelta;
import nl.nfi.cnfnorm.trace.Stage;
import nl.nfi.cnfnorm.trace.TraceSink;
import nl.nfi.cnfnorm.trace.TransformationEvent;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

import static java.nio.charset.StandardCharsets.UTF_8;
import static nl.nfi.cnfnorm.serialize.TraceCodec.Decoder;
import static nl.nfi.cnfnorm.serialize.TraceCodec.Encoder;

// line-delimited json trace, e.g.:
//      {"magic":"cnft","version":1,"grammar":{"start":"S","rules":[...]}}
//      {"stage":"epsilon","action":"expand","affected":["S"],"description":"...","delta":{"removed":[],"added":[...]}}
// snapshots are optional, the decoder replays deltas and checks any written snapshot
public abstract sealed class TraceCodec implements Closeable permits Encoder, Decoder {

    private static final String MAGIC = "cnft";
    private static final int FORMAT_VERSION = 1;

    public static Encoder forOutput(final OutputStream output, final boolean includeSnapshots) {
        return new Encoder(new BufferedWriter(new OutputStreamWriter(output, UTF_8)), includeSnapshots);
    }

    public static Decoder forInput(final InputStream input) {
        return new Decoder(new BufferedReader(new InputStreamReader(input, UTF_8)));
    }

    public record Trace(Grammar initial, List<TransformationEvent> events) {
    }

    // streams events while the pipeline runs, write the header before the first event
    public static final class Encoder extends TraceCodec implements TraceSink {

        private final BufferedWriter writer;
        private final boolean includeSnapshots;
        private boolean headerWritten;

        private Encoder(final BufferedWriter writer, final boolean includeSnapshots) {
            this.writer = writer;
            this.includeSnapshots = includeSnapshots;
        }

        public void writeHeader(final Grammar initial) throws IOException {
            final JSONObject header = new JSONObject();
            header.put("magic", MAGIC);
            header.put("version", FORMAT_VERSION);
            header.put("grammar", encodeGrammar(initial));
            writeLine(header);
            headerWritten = true;
        }

        public void write(final TransformationEvent event) throws IOException {
            if (!headerWritten) {
                throw new IllegalStateException("Trace header must be written before the first event");
            }
            final JSONObject line = new JSONObject();
            line.put("stage", event.stage().key());
            line.put("action", event.action());
            line.put("affected", names(event.affectedVariables()));
            line.put("description", event.description());

            final GrammarDelta delta = event.delta();
            final JSONObject encodedDelta = new JSONObject();
            delta.startSymbol().ifPresent(start -> encodedDelta.put("start", start.name()));
            encodedDelta.put("removed", encodeRules(delta.removed()));
            encodedDelta.put("added", encodeRules(delta.added()));
            line.put("delta", encodedDelta);

            if (includeSnapshots) {
                line.put("snapshot", encodeGrammar(event.snapshot()));
            }
            writeLine(line);
        }

        public void write(final Grammar initial, final Collection<TransformationEvent> events) throws IOException {
            writeHeader(initial);
            for (final TransformationEvent event : events) {
                write(event);
            }
        }

        @Override
        public void accept(final TransformationEvent event) {
            try {
                write(event);
            } catch (final IOException e) {
                throw new UncheckedIOException(e);
            }
        }

        private void writeLine(final JSONObject line) throws IOException {
            writer.write(line.toString());
            writer.newLine();
        }

        @Override
        public void close() throws IOException {
            writer.close();
        }
    }

    public static final class Decoder extends TraceCodec {

        private final BufferedReader reader;

        private Decoder(final BufferedReader reader) {
            this.reader = reader;
        }

        public Trace read() throws IOException {
            final String headerLine = reader.readLine();
            if (headerLine == null) {
                throw new IOException("Empty trace");
            }
            try {
                final JSONObject header = new JSONObject(headerLine);
                if (!MAGIC.equals(header.optString("magic"))) {
                    throw new IOException("Not a trace, missing magic '%s'".formatted(MAGIC));
                }
                if (header.getInt("version") != FORMAT_VERSION) {
                    throw new IOException("Unsupported trace version: %d".formatted(header.getInt("version")));
                }

                final Grammar initial = decodeGrammar(header.getJSONObject("grammar"));
                final List<TransformationEvent> events = new ArrayList<>();

                Grammar snapshot = initial;
                String line;
                while ((line = reader.readLine()) != null) {
                    if (line.isBlank()) {
                        continue;
                    }
                    final TransformationEvent event = decodeEvent(new JSONObject(line), snapshot);
                    events.add(event);
                    snapshot = event.snapshot();
                }
                return new Trace(initial, events);
            } catch (final JSONException | MalformedGrammarException e) {
                throw new IOException("Corrupt trace: " + e.getMessage(), e);
            }
        }

        private static TransformationEvent decodeEvent(final JSONObject line, final Grammar previous) throws IOException {
            final JSONObject encodedDelta = line.getJSONObject("delta");
            final GrammarDelta delta = new GrammarDelta(
                    encodedDelta.has("start") ? Optional.of(NonTerminal.of(encodedDelta.getString("start"))) : Optional.empty(),
                    decodeRules(encodedDelta.getJSONArray("removed")),
                    decodeRules(encodedDelta.getJSONArray("added"))
            );
            final Grammar snapshot = delta.applyTo(previous);
            if (line.has("snapshot") && !snapshot.equals(decodeGrammar(line.getJSONObject("snapshot")))) {
                throw new IOException("Replayed snapshot differs from the recorded one at action '%s'".formatted(line.getString("action")));
            }

            final List<NonTerminal> affected = new ArrayList<>();
            final JSONArray encodedAffected = line.getJSONArray("affected");
            for (int i = 0; i < encodedAffected.length(); i++) {
                affected.add(NonTerminal.of(encodedAffected.getString(i)));
            }

            return new TransformationEvent(
                    Stage.forKey(line.getString("stage")),
                    line.getString("action"),
                    affected,
                    delta,
                    snapshot,
                    line.optString("description")
            );
        }

        @Override
        public void close() throws IOException {
            reader.close();
        }
    }

    private static JSONObject encodeGrammar(final Grammar grammar) {
        final JSONObject encoded = new JSONObject();
        encoded.put("start", grammar.startSymbol().name());
        encoded.put("rules", encodeRules(grammar.rules()));
        return encoded;
    }

    private static Grammar decodeGrammar(final JSONObject encoded) {
        // rebuilt as recorded, intermediate snapshots are not validated
        Grammar grammar = Grammar.empty(NonTerminal.of(encoded.getString("start")));
        for (final Rule rule : decodeRules(encoded.getJSONArray("rules"))) {
            grammar = grammar.withProduction(rule.lhs(), rule.body());
        }
        return grammar;
    }

    private static JSONArray encodeRules(final List<Rule> rules) {
        final JSONArray encoded = new JSONArray();
        rules.forEach(rule -> encoded.put(GrammarFormatter.formatRule(rule)));
        return encoded;
    }

    private static List<Rule> decodeRules(final JSONArray encoded) {
        final List<Rule> rules = new ArrayList<>(encoded.length());
        for (int i = 0; i < encoded.length(); i++) {
            rules.add(GrammarParser.parseRule(encoded.getString(i)));
        }
        return rules;
    }

    private static JSONArray names(final List<NonTerminal> variables) {
        final JSONArray encoded = new JSONArray();
        variables.forEach(variable -> encoded.put(variable.name()));
        return encoded;
    }
}
