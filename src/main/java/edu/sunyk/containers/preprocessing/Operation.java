package edu.sunyk.containers.preprocessing;

import edu.sunyk.containers.trees.Entry;
import edu.sunyk.containers.trees.RedBlackTree;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * One row of an operation script.
 */
public final class Operation<K extends Comparable<K>> {

    public enum Kind {
        INSERT(3, true),
        DELETE(2, true),
        FIND(2, false),
        VALIDATE(1, false),
        RENDER(1, false),
        INORDER(1, false),
        PREORDER(1, false),
        POSTORDER(1, false),
        CLEAR(1, true);

        private final int cells;
        private final boolean mutation;

        Kind(int cells, boolean mutation) {
            this.cells = cells;
            this.mutation = mutation;
        }

        /** Number of CSV cells a row of this kind has, the operation name included. */
        public int cells()          { return cells; }
        public boolean isMutation() { return mutation; }

        public static Kind parse(String name) {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        }
    }

    private final Kind kind;
    private final K key;
    private final String value;
    private final long line;

    Operation(Kind kind, K key, String value, long line) {
        this.kind = kind;
        this.key = key;
        this.value = value;
        this.line = line;
    }

    public Kind kind()     { return kind; }
    public K key()         { return key; }
    public String value()  { return value; }
    public long line()     { return line; }

    /**
     * Runs this operation against {@code tree}.
     *
     * @return a printable line describing the outcome
     */
    public String applyTo(RedBlackTree<K, String> tree) {
        switch(kind) {
            case INSERT: {
                String old = tree.insert(key, value);
                return old == null ? "insert " + key + "=" + value
                                   : "insert " + key + "=" + value + " (replaced " + old + ")";
            }
            case DELETE: {
                Entry<K, String> removed = tree.delete(key);
                return "delete " + key + " -> " + (removed == null ? "not found" : removed);
            }
            case FIND: {
                String found = tree.find(key);
                return "find " + key + " -> " + (found == null ? "not found" : found);
            }
            case VALIDATE:
                return "validate -> " + tree.validate();
            case RENDER:
                return tree.isEmpty() ? "(empty)" : tree.render().trim();
            case INORDER:
                return "inorder " + keys(tree.inorder());
            case PREORDER:
                return "preorder " + keys(tree.preorder());
            case POSTORDER:
                return "postorder " + keys(tree.postorder());
            case CLEAR:
                tree.clear();
                return "clear";
            default:
                throw new AssertionError(kind);
        }
    }

    private static <K> String keys(List<Entry<K, String>> entries) {
        return entries.stream()
                      .map(e -> String.valueOf(e.key()))
                      .collect(Collectors.joining(", ", "[", "]"));
    }

    @Override
    public String toString() {
        switch(kind.cells()) {
            case 3:  return kind + " " + key + "=" + value;
            case 2:  return kind + " " + key;
            default: return kind.toString();
        }
    }
}
