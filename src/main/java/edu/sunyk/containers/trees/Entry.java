package edu.sunyk.containers.trees;

/**
 * A key/value pair handed out by the tree. Entries are snapshots: later
 * mutations of the tree do not show through them.
 */
public interface Entry<K, V> {
    public K key();
    public V value();
}
