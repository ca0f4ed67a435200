package com.warpmap.graph;

import com.warpmap.models.TransitionKind;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Undirected map-to-map transitions, stored as two directed keys "[a]-[b]" and
 * "[b]-[a]". Both keys of a pair are always written together.
 */
public class TransitionGraph {

    private final Map<String, TransitionKind> transitions = new HashMap<>();
    private final TransitionConflictPolicy policy;

    public TransitionGraph() {
        this(TransitionConflictPolicy.LAST_WRITE_WINS);
    }

    public TransitionGraph(TransitionConflictPolicy policy) {
        this.policy = policy != null ? policy : TransitionConflictPolicy.LAST_WRITE_WINS;
    }

    public static String key(int from, int to) {
        return "[" + from + "]-[" + to + "]";
    }

    public void record(int a, int b, TransitionKind kind) {
        if (kind == null) {
            throw new IllegalArgumentException("Transition kind is required");
        }
        String forward = key(a, b);
        String backward = key(b, a);
        TransitionKind stored = policy.resolve(transitions.get(forward), kind);
        transitions.put(forward, stored);
        transitions.put(backward, stored);
    }

    public TransitionKind kindOf(int from, int to) {
        return transitions.get(key(from, to));
    }

    public boolean contains(int from, int to) {
        return transitions.containsKey(key(from, to));
    }

    public int size() {
        return transitions.size();
    }

    public long count(TransitionKind kind) {
        return transitions.values().stream().filter(kind::equals).count();
    }

    /**
     * Keys sorted lexicographically, values as their wire labels.
     */
    public Map<String, String> asSortedMap() {
        Map<String, String> sorted = new TreeMap<>();
        for (Map.Entry<String, TransitionKind> entry : transitions.entrySet()) {
            sorted.put(entry.getKey(), entry.getValue().getLabel());
        }
        return Collections.unmodifiableMap(sorted);
    }
}
