package com.boxsort.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Traversal rule a worker follows when several boxes still need the same barcode.
 *
 * Each variant picks one box from the candidate box numbers sorted ascending.
 * Selection is a pure function of the candidate set, so re-resolving against an
 * unchanged set always yields the same box.
 */
public enum AllocationPattern {

    ASCENDING("ascending") {
        @Override
        int pick(List<Integer> ascending) {
            return ascending.get(0);
        }
    },

    DESCENDING("descending") {
        @Override
        int pick(List<Integer> ascending) {
            return ascending.get(ascending.size() - 1);
        }
    },

    MIDDLE_UP("middle_up") {
        @Override
        int pick(List<Integer> ascending) {
            return ascending.get(ascending.size() / 2);
        }
    },

    MIDDLE_DOWN("middle_down") {
        @Override
        int pick(List<Integer> ascending) {
            // index n/2 of the descending order
            return ascending.get(ascending.size() - 1 - ascending.size() / 2);
        }
    };

    private final String wireName;

    AllocationPattern(String wireName) {
        this.wireName = wireName;
    }

    abstract int pick(List<Integer> ascending);

    /**
     * Selects the target box among the given candidates.
     *
     * @param boxNumbers candidate box numbers, in any order; duplicates are ignored
     * @return the selected box number, or empty when there are no candidates
     */
    public Optional<Integer> select(Collection<Integer> boxNumbers) {
        if (boxNumbers == null || boxNumbers.isEmpty()) {
            return Optional.empty();
        }
        List<Integer> ascending = boxNumbers.stream().distinct().sorted().toList();
        return Optional.of(pick(ascending));
    }

    /**
     * Pattern handed to the n-th worker attached to a job (0 based), cycling every four workers.
     */
    public static AllocationPattern forWorkerIndex(int workerIndex) {
        AllocationPattern[] all = values();
        return all[Math.floorMod(workerIndex, all.length)];
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    @JsonCreator
    public static AllocationPattern fromWireName(String value) {
        for (AllocationPattern pattern : values()) {
            if (pattern.wireName.equalsIgnoreCase(value) || pattern.name().equalsIgnoreCase(value)) {
                return pattern;
            }
        }
        throw new IllegalArgumentException("Unknown allocation pattern: " + value);
    }
}
