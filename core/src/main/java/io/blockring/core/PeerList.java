package io.blockring.core;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * Immutable, ordered list of peer ids.
 * <p>
 * Where a list comes out of a ring placement query, position is placement rank:
 * index 0 is the primary holder, index 1 the second replica, and so on. All set
 * operations therefore preserve the receiver's order, and never reorder by hash
 * or by sort.
 * <p>
 * Binary operations are O(|a|·|b|); peer lists stay in the tens to low
 * hundreds of entries.
 */
public final class PeerList implements Iterable<String> {

    private static final PeerList EMPTY = new PeerList(List.of());

    private final List<String> ids;

    private PeerList(List<String> ids) {
        this.ids = ids;
    }

    public static PeerList empty() {
        return EMPTY;
    }

    public static PeerList of(String... ids) {
        return copyOf(List.of(ids));
    }

    /** Copy of the given ids, in iteration order. Nulls are rejected. */
    public static PeerList copyOf(Collection<String> ids) {
        Objects.requireNonNull(ids, "ids");
        if (ids.isEmpty()) return EMPTY;
        return new PeerList(List.copyOf(ids));
    }

    public int size() {
        return ids.size();
    }

    public boolean isEmpty() {
        return ids.isEmpty();
    }

    public String get(int index) {
        return ids.get(index);
    }

    /** Read-only view of the ids. */
    public List<String> asList() {
        return ids;
    }

    /** Position of the first occurrence of {@code id}, or -1. */
    public int indexOf(String id) {
        for (int i = 0; i < ids.size(); i++) {
            if (ids.get(i).equals(id)) {
                return i;
            }
        }
        return -1;
    }

    public boolean has(String id) {
        return indexOf(id) != -1;
    }

    /** Elements of this list not present in {@code other}, in this list's order. */
    public PeerList andNot(PeerList other) {
        List<String> out = new ArrayList<>(ids.size());
        for (String id : ids) {
            if (!other.has(id)) {
                out.add(id);
            }
        }
        return copyOf(out);
    }

    /**
     * All of this list in order, followed by the elements of {@code other} that
     * are not already here, in {@code other}'s order. Not symmetric: the
     * receiver's ranks always come first.
     */
    public PeerList union(PeerList other) {
        List<String> out = new ArrayList<>(ids.size() + other.size());
        out.addAll(ids);
        for (String id : other) {
            if (!has(id)) {
                out.add(id);
            }
        }
        return copyOf(out);
    }

    /** Elements of this list present in {@code other}, in this list's order. */
    public PeerList intersect(PeerList other) {
        List<String> out = new ArrayList<>(Math.min(ids.size(), other.size()));
        for (String id : ids) {
            if (other.has(id)) {
                out.add(id);
            }
        }
        return copyOf(out);
    }

    /** Elements in [fromInclusive, toExclusive). */
    public PeerList subList(int fromInclusive, int toExclusive) {
        return copyOf(ids.subList(fromInclusive, toExclusive));
    }

    /** The first {@code n} elements, or the whole list if it is shorter. */
    public PeerList prefix(int n) {
        if (n < 0) throw new IllegalArgumentException("n must be >= 0");
        if (n >= ids.size()) return this;
        return subList(0, n);
    }

    @Override
    public Iterator<String> iterator() {
        return ids.iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PeerList other)) return false;
        return ids.equals(other.ids);
    }

    @Override
    public int hashCode() {
        return ids.hashCode();
    }

    @Override
    public String toString() {
        return ids.toString();
    }
}
