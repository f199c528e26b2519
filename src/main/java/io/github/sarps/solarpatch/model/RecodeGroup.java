package io.github.sarps.solarpatch.model;

import java.util.Set;

/**
 * A set of equivalent secondary-instrument codes and the primary-vocabulary code they
 * are all rewritten to.
 *
 * @param sources secondary codes claimed by this group
 * @param target  primary code written in their place
 */
public record RecodeGroup(Set<Integer> sources, int target) {

    public RecodeGroup {
        if (sources == null || sources.isEmpty()) {
            throw new IllegalArgumentException("Recode group for target " + target + " has no source codes");
        }
        if (target < 0) {
            throw new IllegalArgumentException("Recode target must be non-negative, got " + target);
        }
        sources = Set.copyOf(sources);
    }
}
