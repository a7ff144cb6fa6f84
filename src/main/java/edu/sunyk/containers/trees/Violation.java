package edu.sunyk.containers.trees;

/**
 * The red-black and bookkeeping rules {@link RedBlackTree#validate()} checks.
 * Rules 1-5 are the colouring rules; rule 0 marks structural bookkeeping
 * (links, order, size) that the colouring rules take for granted.
 */
public enum Violation {
    INVALID_COLOR(1, "node is neither red nor black"),
    RED_ROOT(2, "root is red"),
    RED_NODE_WITH_RED_CHILD(3, "red node has a red child"),
    BLACK_HEIGHT_MISMATCH(4, "left and right subtrees have different black heights"),
    RED_SENTINEL(5, "sentinel is not black"),
    CORRUPTED_SENTINEL(0, "sentinel links were overwritten"),
    BROKEN_PARENT_LINK(0, "parent link does not point back to the owning node"),
    KEYS_OUT_OF_ORDER(0, "in-order keys are decreasing"),
    SIZE_MISMATCH(0, "size counter differs from the number of nodes");

    private final int rule;
    private final String message;

    Violation(int rule, String message) {
        this.rule = rule;
        this.message = message;
    }

    public int rule()        { return rule; }
    public String message()  { return message; }

    @Override
    public String toString() {
        return rule == 0 ? message : "rule " + rule + ": " + message;
    }
}
