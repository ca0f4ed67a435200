package com.warpmap.graph;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.warpmap.models.TransitionKind;
import com.warpmap.storage.JsonStorage;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only view over a transitions_weak.json artifact, for consumers that
 * check whether a move between two maps is a known transition.
 */
public class TransitionIndex {

    private final Map<String, TransitionKind> transitions;

    private TransitionIndex(Map<String, TransitionKind> transitions) {
        this.transitions = Collections.unmodifiableMap(transitions);
    }

    public static TransitionIndex load(Path artifact) throws IOException {
        return load(artifact, JsonStorage.mapper());
    }

    public static TransitionIndex load(Path artifact, ObjectMapper objectMapper) throws IOException {
        JsonNode root = objectMapper.readTree(artifact.toFile());
        if (root == null || !root.isObject()) {
            throw new IOException("Expected a JSON object of transitions in " + artifact);
        }
        Map<String, TransitionKind> transitions = new HashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode value = field.getValue();
            if (!value.isTextual()) {
                throw new IOException("Transition value for " + field.getKey() + " must be a string");
            }
            TransitionKind kind = TransitionKind.fromLabel(value.asText());
            if (kind == null) {
                throw new IOException("Unknown transition kind '" + value.asText() + "' for " + field.getKey());
            }
            transitions.put(field.getKey(), kind);
        }
        return new TransitionIndex(transitions);
    }

    public static TransitionIndex of(TransitionGraph graph) {
        Map<String, TransitionKind> transitions = new HashMap<>();
        graph.asSortedMap().forEach((key, label) -> transitions.put(key, TransitionKind.fromLabel(label)));
        return new TransitionIndex(transitions);
    }

    public boolean isValidPair(int fromMapId, int toMapId) {
        return transitions.containsKey(TransitionGraph.key(fromMapId, toMapId));
    }

    public Optional<TransitionKind> kindOf(int fromMapId, int toMapId) {
        return Optional.ofNullable(transitions.get(TransitionGraph.key(fromMapId, toMapId)));
    }

    public int size() {
        return transitions.size();
    }
}
