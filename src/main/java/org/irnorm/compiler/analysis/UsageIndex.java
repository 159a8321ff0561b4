package org.irnorm.compiler.analysis;

import org.irnorm.compiler.ir.IrNode;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Read/rebind index over one statement sequence.
 * <p>
 * Built with a single backward scan that asks the {@link ScopeWalker} for each statement's free
 * names and block-level bindings once. Every query afterwards is a lookup or a binary search,
 * so a pass can ask "is {@code x} used after statement {@code i}" for every {@code i} without
 * rescanning the tail.
 */
public final class UsageIndex {

    private static final int[] NONE = new int[0];

    private final int size;
    private final Map<String, int[]> reads;
    private final Map<String, int[]> binds;
    private final long nodeVisits;

    private UsageIndex(int size, Map<String, int[]> reads, Map<String, int[]> binds, long nodeVisits) {
        this.size = size;
        this.reads = reads;
        this.binds = binds;
        this.nodeVisits = nodeVisits;
    }

    /**
     * Builds the index for a statement sequence.
     * @param statements The statements, in execution order.
     * @return The index.
     */
    public static UsageIndex build(List<IrNode> statements) {
        ScopeWalker walker = new ScopeWalker();
        Map<String, List<Integer>> readPositions = new HashMap<>();
        Map<String, List<Integer>> bindPositions = new HashMap<>();
        for (int i = statements.size() - 1; i >= 0; i--) {
            IrNode statement = statements.get(i);
            for (String name : walker.freeNames(statement)) {
                readPositions.computeIfAbsent(name, k -> new ArrayList<>()).add(i);
            }
            for (String name : walker.statementBindings(statement)) {
                bindPositions.computeIfAbsent(name, k -> new ArrayList<>()).add(i);
            }
        }
        return new UsageIndex(statements.size(), ascending(readPositions), ascending(bindPositions), walker.visits());
    }

    /**
     * @return The number of indexed statements.
     */
    public int size() {
        return size;
    }

    /**
     * @param from First statement index to consider.
     * @param name A variable name.
     * @return {@code true} if the name is read in {@code statements[from..size)}.
     */
    public boolean usedLater(int from, String name) {
        int[] positions = reads.getOrDefault(name, NONE);
        return positions.length > 0 && positions[positions.length - 1] >= from;
    }

    /**
     * Whether the current binding of {@code name} is still observed from {@code from} on: the name
     * is read at or after {@code from} and no later than the first statement that rebinds it. The
     * rebinding statement itself may read the old value ({@code x = x + 1}).
     * @param from First statement index to consider.
     * @param name A variable name.
     * @return {@code true} if the current value is read.
     */
    public boolean readBeforeRebind(int from, String name) {
        int read = firstAtOrAfter(reads.getOrDefault(name, NONE), from);
        if (read < 0) {
            return false;
        }
        int rebind = firstAtOrAfter(binds.getOrDefault(name, NONE), from);
        return rebind < 0 || read <= rebind;
    }

    /**
     * @param from First statement index to consider.
     * @param name A variable name.
     * @return {@code true} if a statement in {@code statements[from..size)} rebinds the name at block level.
     */
    public boolean reboundFrom(int from, String name) {
        return firstAtOrAfter(binds.getOrDefault(name, NONE), from) >= 0;
    }

    /**
     * @param from First statement index to consider.
     * @return All names read in {@code statements[from..size)}.
     */
    public Set<String> namesFrom(int from) {
        Set<String> names = new LinkedHashSet<>();
        reads.forEach((name, positions) -> {
            if (positions[positions.length - 1] >= from) {
                names.add(name);
            }
        });
        return names;
    }

    /**
     * @return The number of IR nodes visited while building the index.
     */
    public long nodeVisits() {
        return nodeVisits;
    }

    private static Map<String, int[]> ascending(Map<String, List<Integer>> descending) {
        Map<String, int[]> out = new HashMap<>(descending.size() * 2);
        descending.forEach((name, positions) -> {
            int[] array = new int[positions.size()];
            for (int i = 0; i < array.length; i++) {
                array[i] = positions.get(array.length - 1 - i);
            }
            out.put(name, array);
        });
        return out;
    }

    private static int firstAtOrAfter(int[] positions, int from) {
        int idx = Arrays.binarySearch(positions, from);
        if (idx < 0) {
            idx = -idx - 1;
        }
        return idx < positions.length ? positions[idx] : -1;
    }
}
