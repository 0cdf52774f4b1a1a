package com.termscan.common.automaton;

import com.google.common.base.Preconditions;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * An Aho-Corasick automaton over integer keywords, used to test in bulk whether any of a fixed set of
 * keywords occurs as a contiguous run of an integer sequence.
 *
 * <p>Each keyword has a priority index, {@code 1} being the highest priority. A search reports a single match,
 * the one of the highest priority keyword occurring anywhere in the scanned sequence.
 *
 * <p>Searching is read-only and can run concurrently, as long as no {@link Mutable#insert(int[], int)} is in flight.
 */
public interface KeywordAutomaton {

    static KeywordAutomaton.Mutable create() {
        return new KeywordAutomatonImpl(List.of());
    }

    /**
     * Builds an automaton from the given keywords, the priority index of each keyword being its 1-based position in
     * the list. When a keyword appears several times, its first occurrence wins.
     *
     * @throws IllegalArgumentException if one of the keywords is empty
     */
    static KeywordAutomaton.Mutable create(final List<int[]> keywords) {
        return new KeywordAutomatonImpl(keywords);
    }

    /**
     * Scans the given sequence and returns the occurrence of the highest priority keyword, recorded at the first
     * position where it completes. Returns an empty optional if no keyword occurs.
     */
    Optional<Match> search(final int[] sequence);

    default boolean containsAny(final int[] sequence) {
        return this.search(sequence).isPresent();
    }

    /**
     * Returns the number of states of this automaton, the root included.
     */
    int size();

    /**
     * @param lastPosition the 1-based position in the scanned sequence where the keyword completes
     * @param keywordIndex the priority index of the matched keyword
     * @param keyword      the matched keyword
     */
    record Match(int lastPosition, int keywordIndex, int[] keyword) {

        public Match(final int lastPosition, final int keywordIndex, final int[] keyword) {
            Preconditions.checkNotNull(keyword, "keyword");
            this.lastPosition = lastPosition;
            this.keywordIndex = keywordIndex;
            this.keyword = keyword.clone();
        }

        @Override
        public int[] keyword() {
            return this.keyword.clone();
        }

        @Override
        public boolean equals(final Object obj) {
            return obj instanceof Match that
                    && this.lastPosition == that.lastPosition
                    && this.keywordIndex == that.keywordIndex
                    && Arrays.equals(this.keyword, that.keyword);
        }

        @Override
        public int hashCode() {
            return 31 * (31 * Integer.hashCode(this.lastPosition) + Integer.hashCode(this.keywordIndex))
                    + Arrays.hashCode(this.keyword);
        }

        @Override
        public String toString() {
            return "Match[lastPosition=" + this.lastPosition + ", keywordIndex=" + this.keywordIndex + ", keyword="
                    + Arrays.toString(this.keyword) + "]";
        }
    }

    interface Mutable extends KeywordAutomaton {

        /**
         * Adds a keyword with the given priority index, then recomputes the failure links of the whole automaton.
         * Prefer building a new automaton when adding many keywords at once.
         *
         * @throws IllegalArgumentException if the keyword is empty or the index is not strictly positive
         */
        void insert(final int[] keyword, final int index);
    }
}
