package com.protein.network.graph;

import com.protein.network.core.UnknownEntityException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Union-find over arbitrary elements with path compression.
 *
 * <p>No rank or size heuristic is used: {@link #union(Object, Object)} always hangs
 * the root of the second argument under the root of the first. Root lookup is
 * iterative, so long interaction chains cannot overflow the stack.</p>
 *
 * <p>Not thread-safe. Elements must be registered with {@link #add(Object)} before
 * they are queried.</p>
 *
 * @param <E> element type, must have value semantics for equals/hashCode
 */
public class DisjointSet<E> {

    private final Map<E, E> parent = new LinkedHashMap<>();

    /**
     * Registers an element as its own root. Returns false if it was already present.
     */
    public boolean add(E element) {
        Objects.requireNonNull(element, "element is required");
        if (parent.containsKey(element)) {
            return false;
        }
        parent.put(element, element);
        return true;
    }

    public boolean contains(E element) {
        return parent.containsKey(element);
    }

    /**
     * Returns the root of the element's set and rewrites every node on the visited
     * path to point straight at that root.
     *
     * @throws UnknownEntityException if the element was never added
     */
    public E find(E element) {
        E root = parent.get(element);
        if (root == null) {
            throw new UnknownEntityException(String.valueOf(element));
        }
        E current = element;
        while (!root.equals(current)) {
            current = root;
            root = parent.get(current);
        }

        E node = element;
        while (!node.equals(root)) {
            E next = parent.get(node);
            parent.put(node, root);
            node = next;
        }
        return root;
    }

    /**
     * Merges the sets of {@code a} and {@code b} and returns the surviving root,
     * which is always the root of {@code a}.
     *
     * @throws UnknownEntityException if either element was never added
     */
    public E union(E a, E b) {
        E rootA = find(a);
        E rootB = find(b);
        if (!rootA.equals(rootB)) {
            parent.put(rootB, rootA);
        }
        return rootA;
    }

    public boolean connected(E a, E b) {
        return find(a).equals(find(b));
    }

    public int size() {
        return parent.size();
    }

    /**
     * Registered elements in insertion order.
     */
    public Set<E> elements() {
        return Collections.unmodifiableSet(parent.keySet());
    }

    /**
     * Groups every element by its root. Groups are listed in the order their first
     * member was added; members keep insertion order.
     */
    public List<List<E>> sets() {
        Map<E, List<E>> byRoot = new LinkedHashMap<>();
        for (E element : new ArrayList<>(parent.keySet())) {
            byRoot.computeIfAbsent(find(element), k -> new ArrayList<>()).add(element);
        }
        return new ArrayList<>(byRoot.values());
    }

    /**
     * Direct parent link, exposed for verifying path compression.
     */
    E parentOf(E element) {
        E p = parent.get(element);
        if (p == null) {
            throw new UnknownEntityException(String.valueOf(element));
        }
        return p;
    }
}
