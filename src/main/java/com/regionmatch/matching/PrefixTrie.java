package com.regionmatch.matching;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Character-keyed prefix tree mapping registered names (full or abbreviated) to a value.
 *
 * Nodes are keyed by Unicode code point, so every reported length ends on a code point
 * boundary and can be passed straight to {@link String#substring(int)}.
 *
 * Not thread-safe while being filled; safe for concurrent reads once construction is done.
 */
public class PrefixTrie<V> {

    private final Node<V> root = new Node<>();
    private int size = 0;

    /**
     * Registers {@code name}, replacing the value of an existing entry with the same key.
     */
    public void insert(String name, V value) {
        Node<V> node = root;
        int offset = 0;
        while (offset < name.length()) {
            int codePoint = name.codePointAt(offset);
            node = node.children.computeIfAbsent(codePoint, k -> new Node<>());
            offset += Character.charCount(codePoint);
        }
        if (!node.terminal) {
            size++;
        }
        node.terminal = true;
        node.value = value;
    }

    /**
     * Exact lookup.
     *
     * @return the stored value, or null if {@code name} was never inserted
     */
    public V get(String name) {
        Node<V> node = root;
        int offset = 0;
        while (offset < name.length()) {
            int codePoint = name.codePointAt(offset);
            node = node.children.get(codePoint);
            if (node == null) {
                return null;
            }
            offset += Character.charCount(codePoint);
        }
        return node.terminal ? node.value : null;
    }

    public boolean contains(String name) {
        return get(name) != null;
    }

    /**
     * Number of distinct registered names.
     */
    public int size() {
        return size;
    }

    /**
     * Finds the longest registered name that {@code text} starts with.
     *
     * The walk does not stop at the first registered name: with both 广东 and 广东省
     * registered, 广东省深圳市 yields 广东省.
     *
     * @return the match, or null if no prefix of {@code text} is registered
     */
    public Match<V> findLongestPrefix(String text) {
        return findLongestPrefix(text, 0);
    }

    private Match<V> findLongestPrefix(String text, int start) {
        Node<V> node = root;
        Node<V> best = null;
        int bestEnd = -1;
        int offset = start;
        while (offset < text.length()) {
            int codePoint = text.codePointAt(offset);
            node = node.children.get(codePoint);
            if (node == null) {
                break;
            }
            offset += Character.charCount(codePoint);
            if (node.terminal) {
                best = node;
                bestEnd = offset;
            }
        }
        if (best == null) {
            return null;
        }
        return new Match<>(text.substring(start, bestEnd), best.value, bestEnd - start);
    }

    /**
     * Reports the longest match starting at every code point of {@code text}, left to right.
     * Matches may overlap.
     */
    public List<Occurrence<V>> findAll(String text) {
        List<Occurrence<V>> occurrences = new ArrayList<>();
        int offset = 0;
        while (offset < text.length()) {
            Match<V> match = findLongestPrefix(text, offset);
            if (match != null) {
                occurrences.add(new Occurrence<>(offset, match));
            }
            offset += Character.charCount(text.codePointAt(offset));
        }
        return occurrences;
    }

    /**
     * A prefix match.
     *
     * @param matched the matched slice of the input
     * @param value   the value registered for the matched name
     * @param length  length of the slice in {@code char} units
     */
    public record Match<V>(String matched, V value, int length) {
    }

    /**
     * A match found by {@link #findAll(String)} together with its start offset in the scanned text.
     */
    public record Occurrence<V>(int offset, Match<V> match) {
    }

    private static class Node<V> {
        private final Map<Integer, Node<V>> children = new HashMap<>();
        private boolean terminal = false;
        private V value;
    }
}
