package nl.nfi.cnfnorm.trace;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static java.util.stream.Collectors.toList;

// collects the events of a single normalization run
public final class TraceRecorder implements TraceSink {

    private final List<TransformationEvent> events = new ArrayList<>();

    @Override
    public void accept(final TransformationEvent event) {
        events.add(event);
    }

    public List<TransformationEvent> events() {
        return Collections.unmodifiableList(events);
    }

    public List<TransformationEvent> eventsOf(final Stage stage) {
        return events.stream().filter(event -> event.stage() == stage).collect(toList());
    }

    public List<String> actionsOf(final Stage stage) {
        return eventsOf(stage).stream().map(TransformationEvent::action).collect(toList());
    }
}
