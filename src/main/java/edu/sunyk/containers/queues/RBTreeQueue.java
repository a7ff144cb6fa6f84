package edu.sunyk.containers.queues;

import static com.google.common.base.Preconditions.checkNotNull;

import edu.sunyk.containers.trees.DuplicatePolicy;
import edu.sunyk.containers.trees.RedBlackTree;
import java.util.NoSuchElementException;

/**
 * Priority queue on top of a red-black tree: {@link #dequeue()} hands out the
 * smallest element, and equal elements leave in the order they arrived.
 */
public class RBTreeQueue<E extends Comparable<E>> implements Queue<E> {
    private final RedBlackTree<E, E> rbTree;

    public RBTreeQueue() {
        rbTree = new RedBlackTree<>(DuplicatePolicy.APPEND);
    }
    public int size() {
        return rbTree.size();
    }
    public boolean isEmpty() {
        return rbTree.isEmpty();
    }
    public void enqueue(E e) {
        checkNotNull(e, "element");
        rbTree.insert(e, e);
    }
    public E dequeue() {
        if(rbTree.isEmpty())
            throw new NoSuchElementException("Empty queue");
        return rbTree.pollFirst().value();
    }
    public E first() {
        if(rbTree.isEmpty())
            throw new NoSuchElementException("Empty queue");
        return rbTree.min().value();
    }
}
