package edu.sunyk.containers.trees;

import edu.sunyk.containers.trees.RedBlackTree.Node;

/**
 * Text diagram of a tree, one node per line in pre-order:
 * <pre>
 * 20B:Root
 * ├── 10R:L
 * └── 30R:R
 * </pre>
 * Meant for eyeballing and test fixtures; the layout may change.
 */
final class TreePrinter {
    private static final String LAST = "└── ";
    private static final String MIDDLE = "├── ";

    private TreePrinter() {
    }

    static <K extends Comparable<K>, V> String render(RedBlackTree<K, V> tree) {
        StringBuilder sb = new StringBuilder();
        render(sb, "", "", tree.root(), tree);
        return sb.toString();
    }

    private static <K extends Comparable<K>, V> void render(StringBuilder sb, String padding, String pointer,
                                                            Node<K, V> node, RedBlackTree<K, V> tree) {
        Node<K, V> nil = tree.nil();
        if(node == nil)
            return;
        sb.append(padding)
          .append(pointer)
          .append(node.key)
          .append(node.isRed() ? "R" : "B")
          .append(':')
          .append(side(node, tree))
          .append('\n');

        String childPadding = pointer.isEmpty() ? padding
                            : padding + (pointer.equals(LAST) ? "    " : "│   ");
        render(sb, childPadding, node.right != nil ? MIDDLE : LAST, node.left, tree);
        render(sb, childPadding, LAST, node.right, tree);
    }

    private static <K extends Comparable<K>, V> String side(Node<K, V> node, RedBlackTree<K, V> tree) {
        if(node.parent == tree.nil())
            return "Root";
        return node.parent.left == node ? "L" : "R";
    }
}
