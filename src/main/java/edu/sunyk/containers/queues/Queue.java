package edu.sunyk.containers.queues;

/**
 * Minimal queue: elements go in with {@link #enqueue} and come out at the front.
 * Which element is at the front is up to the implementation. {@link #dequeue()}
 * and {@link #first()} throw {@link java.util.NoSuchElementException} when empty.
 */
public interface Queue<E> {
    public int size();
    public boolean isEmpty();
    public void enqueue(E e);
    public E dequeue();
    public E first();
}
