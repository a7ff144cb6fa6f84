package edu.sunyk.containers.trees;

/**
 * Thrown when the tree finds its own node graph in a state its algorithms never
 * produce, e.g. the sentinel where a real node is required. This is a bug in
 * the tree, not bad input, and callers are not expected to recover from it.
 */
public class BrokenInvariantException extends IllegalStateException {
    private static final long serialVersionUID = 1L;

    public BrokenInvariantException(String message) {
        super(message);
    }
}
