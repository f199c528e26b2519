package io.github.sarps.solarpatch.model;

import io.github.sarps.solarpatch.exception.ConfigurationException;

import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Fixed translation from the secondary instrument's category codes to the primary
 * instrument's vocabulary.
 *
 * <p>A code is translated by {@link #translate(int)} as follows:</p>
 * <ol>
 *   <li>{@code 0} (background) stays {@code 0}.</li>
 *   <li>A code claimed by a group becomes that group's target.</li>
 *   <li>A code that is already a group target is passed through silently.</li>
 *   <li>Any other code is <em>uncovered</em>. If it lies in the secondary numeric range
 *       {@code [offset, 2 * offset)} the global offset is subtracted, otherwise it is
 *       passed through unchanged. Either way it is reported.</li>
 * </ol>
 *
 * <p>Construction rejects tables that could not be applied as a total, idempotent
 * function: a source code claimed by two groups, a target that is itself a source, a
 * target inside the secondary range, or a source outside it.</p>
 *
 * @since 0.1.0
 */
public final class RecodeTable {

    private final List<RecodeGroup> groups;
    private final int offset;
    private final Map<Integer, Integer> lookup;
    private final Set<Integer> targets;

    /**
     * @param groups code groups, each source code claimed by exactly one group
     * @param offset global offset between the two vocabularies ({@code 0} disables it)
     * @throws ConfigurationException if the table is inconsistent
     */
    public RecodeTable(List<RecodeGroup> groups, int offset) {
        if (groups == null) {
            throw new ConfigurationException("Recode groups must not be null");
        }
        if (offset < 0) {
            throw new ConfigurationException("Recode offset must be non-negative, got " + offset);
        }
        Map<Integer, Integer> map = new HashMap<>();
        Set<Integer> targetCodes = new HashSet<>();
        for (RecodeGroup group : groups) {
            for (int source : group.sources()) {
                Integer previous = map.put(source, group.target());
                if (previous != null) {
                    throw new ConfigurationException(String.format(
                            "Source code %d is claimed by the groups for %d and %d", source, previous, group.target()));
                }
                if (source == 0) {
                    throw new ConfigurationException("Background code 0 cannot be recoded");
                }
                if (offset > 0 && !inSecondaryRange(source, offset)) {
                    throw new ConfigurationException(String.format(
                            "Source code %d lies outside the secondary range [%d, %d)", source, offset, 2 * offset));
                }
            }
            targetCodes.add(group.target());
        }
        for (int target : targetCodes) {
            if (map.containsKey(target)) {
                throw new ConfigurationException("Target code " + target + " is also a source code; recoding would not be idempotent");
            }
            if (offset > 0 && inSecondaryRange(target, offset)) {
                throw new ConfigurationException(String.format(
                        "Target code %d lies inside the secondary range [%d, %d)", target, offset, 2 * offset));
            }
        }
        this.groups = List.copyOf(groups);
        this.offset = offset;
        this.lookup = Collections.unmodifiableMap(map);
        this.targets = Collections.unmodifiableSet(targetCodes);
    }

    /**
     * Translates a single code. See the class description for the rules.
     */
    public int translate(int code) {
        if (code == 0) {
            return 0;
        }
        Integer target = lookup.get(code);
        if (target != null) {
            return target;
        }
        if (offset > 0 && inSecondaryRange(code, offset)) {
            return code - offset;
        }
        return code;
    }

    /**
     * Whether {@code code} is background, claimed by a group, or already a target code.
     */
    public boolean covers(int code) {
        return code == 0 || lookup.containsKey(code) || targets.contains(code);
    }

    public List<RecodeGroup> getGroups() { return groups; }

    public int getOffset() { return offset; }

    public Set<Integer> getTargets() { return targets; }

    private static boolean inSecondaryRange(int code, int offset) {
        return code >= offset && code < 2 * offset;
    }

    @Override
    public String toString() {
        return "RecodeTable[offset=" + offset + ", groups=" + groups + "]";
    }
}
