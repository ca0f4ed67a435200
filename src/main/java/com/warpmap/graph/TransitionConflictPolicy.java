package com.warpmap.graph;

import com.warpmap.models.TransitionKind;

/**
 * Decides what a map pair ends up as when a second transition is recorded for it.
 * Warps are resolved before connections, so under LAST_WRITE_WINS a pair that is
 * both warp-linked and adjacent ends up as overworld.
 */
@FunctionalInterface
public interface TransitionConflictPolicy {

    TransitionConflictPolicy LAST_WRITE_WINS = (existing, incoming) -> incoming;

    TransitionConflictPolicy KEEP_FIRST = (existing, incoming) -> existing != null ? existing : incoming;

    /**
     * @param existing kind already stored for the pair, or null
     * @param incoming kind being recorded
     * @return kind to store for both directions of the pair
     */
    TransitionKind resolve(TransitionKind existing, TransitionKind incoming);
}
