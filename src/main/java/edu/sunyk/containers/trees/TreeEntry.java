package edu.sunyk.containers.trees;

import java.util.Objects;

final class TreeEntry<K, V> implements Entry<K, V> {
    private final K key;
    private final V value;

    TreeEntry(K key, V value) {
        this.key = key;
        this.value = value;
    }

    public K key()   { return key; }
    public V value() { return value; }

    @Override
    public boolean equals(Object o) {
        if(this == o)
            return true;
        if(!(o instanceof Entry))
            return false;
        Entry<?, ?> other = (Entry<?, ?>) o;
        return Objects.equals(key, other.key()) && Objects.equals(value, other.value());
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, value);
    }

    @Override
    public String toString() {
        return key + "=" + value;
    }
}
