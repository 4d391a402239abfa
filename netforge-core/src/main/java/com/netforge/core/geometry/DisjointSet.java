package com.netforge.core.geometry;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Disjoint-set forest over arbitrary keys.
 *
 * <p>{@link #find(Object)} walks parent links iteratively and compresses the
 * path in a second pass, so deep chains built from long wires never touch the
 * call stack. No removal is supported: a set is built once per export and
 * discarded.
 *
 * @param <T> element type, must have value semantics
 */
public class DisjointSet<T> {

    private final Map<T, T> parent = new LinkedHashMap<>();

    /**
     * Adds an element as its own singleton group if not already present.
     *
     * @param item element to add
     */
    public void add(T item) {
        Objects.requireNonNull(item, "item must not be null");
        parent.putIfAbsent(item, item);
    }

    /**
     * Returns whether the element has been added.
     *
     * @param item element to check
     * @return true when known
     */
    public boolean contains(T item) {
        return parent.containsKey(item);
    }

    /**
     * Returns the representative of the element's group, adding it first if needed.
     *
     * @param item element to look up
     * @return group root
     */
    public T find(T item) {
        add(item);
        T root = item;
        T next = parent.get(root);
        while (!next.equals(root)) {
            root = next;
            next = parent.get(root);
        }

        T current = item;
        while (!current.equals(root)) {
            T up = parent.get(current);
            parent.put(current, root);
            current = up;
        }
        return root;
    }

    /**
     * Merges the groups of two elements. The first element's root survives.
     *
     * @param a first element
     * @param b second element
     */
    public void union(T a, T b) {
        T rootA = find(a);
        T rootB = find(b);
        if (!rootA.equals(rootB)) {
            parent.put(rootB, rootA);
        }
    }

    /**
     * Returns whether two elements are in the same group.
     *
     * @param a first element
     * @param b second element
     * @return true when connected
     */
    public boolean connected(T a, T b) {
        return find(a).equals(find(b));
    }

    /**
     * Groups every element by its root. Members keep insertion order.
     *
     * @return root to members mapping
     */
    public Map<T, List<T>> groups() {
        Map<T, List<T>> out = new LinkedHashMap<>();
        for (T item : new ArrayList<>(parent.keySet())) {
            out.computeIfAbsent(find(item), k -> new ArrayList<>()).add(item);
        }
        return out;
    }

    /**
     * Returns the number of elements added.
     *
     * @return element count
     */
    public int size() {
        return parent.size();
    }
}
