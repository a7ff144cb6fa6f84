package edu.sunyk.containers.trees;

/**
 * What {@link RedBlackTree#insert(Comparable, Object)} does with a key that is already present.
 */
public enum DuplicatePolicy {
    /**
     * Keep the old entry and add the new one right of it, so equal keys sit in
     * insertion order and {@code size} grows by one.
     */
    APPEND,
    /**
     * Overwrite the value of the existing entry in place; {@code size} is unchanged.
     */
    REPLACE
}
