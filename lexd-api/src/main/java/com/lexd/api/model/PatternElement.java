package com.lexd.api.model;

import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * One reference inside a pattern body.
 *
 * <p>A symmetric reference {@code X(2)} has equal left and right tokens. A one-sided
 * reference {@code X(1):} or {@code :X(1)} leaves the other token empty, and a collated
 * reference {@code X(1):Y(2)} pairs the left side of X's entry <i>i</i> with the right
 * side of Y's entry <i>i</i>.
 *
 * <p>Equality covers every field, so elements are used directly as cache keys.
 */
public record PatternElement(
        Token left,
        Token right,
        RepeatMode mode,
        SortedSet<SymbolHandle> tags,
        SortedSet<SymbolHandle> negatedTags
) implements Comparable<PatternElement> {

    private static final Comparator<SortedSet<SymbolHandle>> SET_ORDER = PatternElement::compareSets;

    private static final Comparator<PatternElement> ORDER = Comparator
            .comparing(PatternElement::left)
            .thenComparing(PatternElement::right)
            .thenComparing(PatternElement::mode)
            .thenComparing(PatternElement::tags, SET_ORDER)
            .thenComparing(PatternElement::negatedTags, SET_ORDER);

    public PatternElement {
        tags = Collections.unmodifiableSortedSet(new TreeSet<>(tags));
        negatedTags = Collections.unmodifiableSortedSet(new TreeSet<>(negatedTags));
        if (left.isEmpty() && right.isEmpty()) {
            throw new IllegalArgumentException("Pattern element needs at least one side");
        }
    }

    /**
     * A symmetric, untagged, non-repeated reference.
     */
    public static PatternElement of(Token token) {
        return new PatternElement(token, token, RepeatMode.NORMAL, new TreeSet<>(), new TreeSet<>());
    }

    /**
     * The referenced lexicon or pattern (the left one for collated references).
     */
    public SymbolHandle name() {
        return left.isEmpty() ? right.name() : left.name();
    }

    public boolean isSymmetric() {
        return left.equals(right);
    }

    public boolean isLeftOnly() {
        return right.isEmpty();
    }

    public boolean isRightOnly() {
        return left.isEmpty();
    }

    public boolean isCollated() {
        return !left.isEmpty() && !right.isEmpty() && !left.equals(right);
    }

    public boolean isUntagged() {
        return tags.isEmpty() && negatedTags.isEmpty();
    }

    /**
     * True when some tag is both required and forbidden.
     */
    public boolean hasTagConflict() {
        for (SymbolHandle tag : tags) {
            if (negatedTags.contains(tag)) {
                return true;
            }
        }
        return false;
    }

    /**
     * A segment is admitted iff it carries every required tag and no forbidden tag.
     */
    public boolean compatible(LexiconSegment segment) {
        if (!segment.tags().containsAll(tags)) {
            return false;
        }
        for (SymbolHandle tag : negatedTags) {
            if (segment.tags().contains(tag)) {
                return false;
            }
        }
        return true;
    }

    public PatternElement withMode(RepeatMode newMode) {
        return new PatternElement(left, right, newMode, tags, negatedTags);
    }

    public PatternElement withoutTags() {
        return new PatternElement(left, right, mode, new TreeSet<>(), new TreeSet<>());
    }

    public PatternElement addTags(Collection<SymbolHandle> added) {
        SortedSet<SymbolHandle> merged = new TreeSet<>(tags);
        merged.addAll(added);
        return new PatternElement(left, right, mode, merged, negatedTags);
    }

    public PatternElement addNegatedTags(Collection<SymbolHandle> added) {
        SortedSet<SymbolHandle> merged = new TreeSet<>(negatedTags);
        merged.addAll(added);
        return new PatternElement(left, right, mode, tags, merged);
    }

    @Override
    public int compareTo(PatternElement other) {
        return ORDER.compare(this, other);
    }

    private static int compareSets(SortedSet<SymbolHandle> a, SortedSet<SymbolHandle> b) {
        Iterator<SymbolHandle> ia = a.iterator();
        Iterator<SymbolHandle> ib = b.iterator();
        while (ia.hasNext() && ib.hasNext()) {
            int cmp = ia.next().compareTo(ib.next());
            if (cmp != 0) {
                return cmp;
            }
        }
        return Boolean.compare(ia.hasNext(), ib.hasNext());
    }
}
