package com.termscan.common.automaton;

import com.google.common.base.Preconditions;
import gnu.trove.impl.Constants;
import gnu.trove.list.array.TIntArrayList;
import gnu.trove.map.TIntIntMap;
import gnu.trove.map.hash.TIntIntHashMap;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class KeywordAutomatonImpl implements KeywordAutomaton.Mutable {

    private static final Logger LOGGER = LoggerFactory.getLogger(KeywordAutomatonImpl.class);

    static final int ROOT = 0;
    static final int NO_STATE = -1;

    private final List<@Nullable TIntIntMap> transitions = new ArrayList<>();
    private final TIntArrayList fail = new TIntArrayList();
    private final TIntArrayList depths = new TIntArrayList();
    private final OutputTable output = new OutputTable();

    KeywordAutomatonImpl(final List<int[]> keywords) {
        Preconditions.checkNotNull(keywords, "keywords");
        for (int i = 0; i < keywords.size(); i++) {
            checkKeyword(keywords.get(i), i + 1);
        }

        this.newState(0);
        for (int i = 0; i < keywords.size(); i++) {
            this.enter(keywords.get(i), i + 1);
        }
        this.linkSuffixes();

        LOGGER.debug("Built keyword automaton with {} states from {} keywords", this.size(), keywords.size());
    }

    @Override
    public void insert(final int[] keyword, final int index) {
        Preconditions.checkArgument(
                index > 0 && index < OutputTable.NONE,
                "The keyword index must be between 1 and %s, got %s",
                OutputTable.NONE - 1,
                index);
        checkKeyword(keyword, index);

        final var previous = this.size();
        this.enter(keyword, index);
        this.linkSuffixes();

        LOGGER.debug(
                "Inserted keyword with index {}, automaton grew from {} to {} states", index, previous, this.size());
    }

    @Override
    public Optional<Match> search(final int[] sequence) {
        Preconditions.checkNotNull(sequence, "sequence");

        var state = ROOT;
        var bestIndex = OutputTable.NONE;
        var bestPosition = 0;
        var bestState = ROOT;

        for (int i = 0; i < sequence.length; i++) {
            final var symbol = sequence[i];
            int next;
            while ((next = this.lookup(state, symbol)) == NO_STATE) {
                state = this.fail.get(state);
            }
            state = next;

            final var index = this.output.index(state);
            if (index < bestIndex) {
                bestIndex = index;
                bestPosition = i + 1;
                bestState = state;
            }
        }

        if (bestIndex == OutputTable.NONE) {
            return Optional.empty();
        }
        return Optional.of(new Match(bestPosition, bestIndex, this.output.keyword(bestState)));
    }

    @Override
    public int size() {
        return this.transitions.size();
    }

    int fail(final int state) {
        return this.fail.get(state);
    }

    int depth(final int state) {
        return this.depths.get(state);
    }

    OutputTable output() {
        return this.output;
    }

    /**
     * Returns the state reached from {@code state} on {@code symbol}, or {@link #NO_STATE}. The root never fails and
     * loops on itself for symbols it has no transition for.
     */
    int lookup(final int state, final int symbol) {
        final var children = this.transitions.get(state);
        final var next = children == null ? NO_STATE : children.get(symbol);
        return next == NO_STATE && state == ROOT ? ROOT : next;
    }

    private int newState(final int depth) {
        this.transitions.add(null);
        this.fail.add(ROOT);
        this.depths.add(depth);
        this.output.add();
        return this.transitions.size() - 1;
    }

    private void enter(final int[] keyword, final int index) {
        var state = ROOT;
        for (final var symbol : keyword) {
            var children = this.transitions.get(state);
            if (children == null) {
                children = new TIntIntHashMap(
                        Constants.DEFAULT_CAPACITY, Constants.DEFAULT_LOAD_FACTOR, Constants.DEFAULT_INT_NO_ENTRY_VALUE,
                        NO_STATE);
                this.transitions.set(state, children);
            }
            var next = children.get(symbol);
            if (next == NO_STATE) {
                next = this.newState(this.depths.get(state) + 1);
                children.put(symbol, next);
            }
            state = next;
        }
        this.output.offer(state, index, keyword.clone());
    }

    /**
     * Recomputes every failure link breadth-first from the root, merging into each state the output of its failure
     * target. Children of the root keep the root as failure target.
     */
    private void linkSuffixes() {
        this.fail.fill(ROOT);
        this.output.reset();

        final var queue = new TIntArrayList();
        final var roots = this.transitions.get(ROOT);
        if (roots != null) {
            queue.add(roots.values());
        }

        for (int head = 0; head < queue.size(); head++) {
            final var state = queue.get(head);
            final var children = this.transitions.get(state);
            if (children == null) {
                continue;
            }

            final var iterator = children.iterator();
            while (iterator.hasNext()) {
                iterator.advance();
                final var symbol = iterator.key();
                final var child = iterator.value();
                queue.add(child);

                var suffix = this.fail.get(state);
                int target;
                while ((target = this.lookup(suffix, symbol)) == NO_STATE) {
                    suffix = this.fail.get(suffix);
                }
                this.fail.set(child, target);
                this.output.inherit(child, target);
            }
        }

        LOGGER.trace("Linked suffixes of {} states", queue.size());
    }

    private static void checkKeyword(final int[] keyword, final int index) {
        Preconditions.checkNotNull(keyword, "keyword");
        Preconditions.checkArgument(keyword.length > 0, "The keyword with index %s is empty", index);
    }
}
