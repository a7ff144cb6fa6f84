package edu.sunyk.containers.trees;

import edu.sunyk.containers.trees.RedBlackTree.Node;

/**
 * Re-derives the black height of every subtree and reports the first rule that
 * does not hold. Reads the tree only. One instance per check.
 */
final class TreeValidator<K extends Comparable<K>, V> {
    private final RedBlackTree<K, V> tree;
    private final Node<K, V> nil;

    private Violation violation;
    private String location;
    private K previousKey;
    private int count;

    TreeValidator(RedBlackTree<K, V> tree) {
        this.tree = tree;
        this.nil = tree.nil();
    }

    ValidationResult validate() {
        if(!nil.isBlack())
            return ValidationResult.invalid(Violation.RED_SENTINEL, "sentinel");
        if(nil.left != nil || nil.right != nil || nil.parent != nil)
            return ValidationResult.invalid(Violation.CORRUPTED_SENTINEL, "sentinel");

        Node<K, V> root = tree.root();
        if(root == nil)
            return tree.size() == 0
                ? ValidationResult.valid(0)
                : ValidationResult.invalid(Violation.SIZE_MISMATCH, "empty tree with size " + tree.size());
        if(root.parent != nil)
            return ValidationResult.invalid(Violation.BROKEN_PARENT_LINK, describe(root));
        if(root.isRed())
            return ValidationResult.invalid(Violation.RED_ROOT, describe(root));

        int height = check(root);
        if(violation != null)
            return ValidationResult.invalid(violation, location);
        if(count != tree.size())
            return ValidationResult.invalid(Violation.SIZE_MISMATCH, count + " nodes, size " + tree.size());
        //the root itself is not counted
        return ValidationResult.valid(height - 1);
    }

    // black height of node including itself and the sentinel, -1 once a violation is recorded
    private int check(Node<K, V> node) {
        if(node == nil)
            return 1;
        if(node.color == null)
            return fail(Violation.INVALID_COLOR, node);
        if(node.left.parent != node && node.left != nil)
            return fail(Violation.BROKEN_PARENT_LINK, node.left);
        if(node.right.parent != node && node.right != nil)
            return fail(Violation.BROKEN_PARENT_LINK, node.right);
        if(node.isRed() && (node.left.isRed() || node.right.isRed()))
            return fail(Violation.RED_NODE_WITH_RED_CHILD, node);

        int left = check(node.left);
        if(left < 0)
            return -1;

        count++;
        if(previousKey != null && node.key.compareTo(previousKey) < 0)
            return fail(Violation.KEYS_OUT_OF_ORDER, node);
        previousKey = node.key;

        int right = check(node.right);
        if(right < 0)
            return -1;
        if(left != right)
            return fail(Violation.BLACK_HEIGHT_MISMATCH, node);
        return node.isBlack() ? left + 1 : left;
    }

    private int fail(Violation v, Node<K, V> node) {
        violation = v;
        location = describe(node);
        return -1;
    }

    private String describe(Node<K, V> node) {
        return "node " + node.key;
    }
}
