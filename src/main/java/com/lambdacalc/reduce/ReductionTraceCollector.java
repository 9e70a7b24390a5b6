package com.lambdacalc.reduce;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import com.lambdacalc.term.Term.TermInterface;

public final class ReductionTraceCollector implements ReductionTrace {

    /** One recorded call, kept as renderings so later events never pin whole trees. */
    public static final class Event {
        public final Operation op;
        public final List<String> inputs;
        public final String result;

        Event(Operation op, List<String> inputs, String result) {
            this.op = op;
            this.inputs = inputs;
            this.result = result;
        }

        @Override
        public String toString() {
            return op + " " + inputs + " -> " + result;
        }
    }

    private final int capacity;
    private final List<Event> events = new ArrayList<>();
    private final EnumMap<Operation, Integer> counts = new EnumMap<>(Operation.class);
    private long dropped;

    public ReductionTraceCollector() {
        this(Integer.MAX_VALUE);
    }

    /** Keeps at most {@code capacity} events; later ones are only counted. */
    public ReductionTraceCollector(int capacity) {
        this.capacity = Math.max(0, capacity);
    }

    @Override
    public void step(Operation op, List<TermInterface> inputs, TermInterface result) {
        counts.merge(op, 1, Integer::sum);
        if (events.size() >= capacity) {
            dropped++;
            return;
        }
        List<String> in = new ArrayList<>(inputs.size());
        for (TermInterface t : inputs) in.add(t.render());
        events.add(new Event(op, Collections.unmodifiableList(in), result.render()));
    }

    public List<Event> events() {
        return Collections.unmodifiableList(events);
    }

    public int count(Operation op) {
        return counts.getOrDefault(op, 0);
    }

    public Map<Operation, Integer> counts() {
        return Collections.unmodifiableMap(counts);
    }

    public long dropped() {
        return dropped;
    }
}
