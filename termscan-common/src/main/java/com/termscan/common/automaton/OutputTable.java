package com.termscan.common.automaton;

import gnu.trove.list.array.TIntArrayList;
import java.util.ArrayList;
import java.util.List;

/**
 * Per-state outputs of a {@link KeywordAutomatonImpl}, indexed by state.
 *
 * <p>A state keeps two records. The terminal record is the best keyword whose path ends exactly at the state. The
 * effective record is the best keyword recognized when reaching the state, suffix matches included.
 */
final class OutputTable {

    static final int NONE = Integer.MAX_VALUE;

    private static final int[] NO_KEYWORD = new int[0];

    private final TIntArrayList terminalIndexes = new TIntArrayList();
    private final List<int[]> terminalKeywords = new ArrayList<>();
    private final TIntArrayList indexes = new TIntArrayList();
    private final List<int[]> keywords = new ArrayList<>();

    void add() {
        this.terminalIndexes.add(NONE);
        this.terminalKeywords.add(NO_KEYWORD);
        this.indexes.add(NONE);
        this.keywords.add(NO_KEYWORD);
    }

    /**
     * Records a keyword ending at the given state, unless a keyword with a lower or equal index already ends there.
     */
    void offer(final int state, final int index, final int[] keyword) {
        if (this.terminalIndexes.get(state) > index) {
            this.terminalIndexes.set(state, index);
            this.terminalKeywords.set(state, keyword);
        }
        if (this.indexes.get(state) > index) {
            this.indexes.set(state, index);
            this.keywords.set(state, keyword);
        }
    }

    /**
     * Replaces the output of {@code state} with the one of {@code suffix} if the latter has a lower index.
     */
    void inherit(final int state, final int suffix) {
        final var index = this.indexes.get(suffix);
        if (index < this.indexes.get(state)) {
            this.indexes.set(state, index);
            this.keywords.set(state, this.keywords.get(suffix));
        }
    }

    /**
     * Drops every inherited output, leaving each state with its terminal record only.
     */
    void reset() {
        for (int state = 0; state < this.indexes.size(); state++) {
            this.indexes.set(state, this.terminalIndexes.get(state));
            this.keywords.set(state, this.terminalKeywords.get(state));
        }
    }

    int index(final int state) {
        return this.indexes.get(state);
    }

    int[] keyword(final int state) {
        return this.keywords.get(state);
    }

    int terminalIndex(final int state) {
        return this.terminalIndexes.get(state);
    }

    int size() {
        return this.indexes.size();
    }
}
