package edu.sunyk.containers.trees;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.annotations.VisibleForTesting;
import java.util.ArrayList;
import java.util.ConcurrentModificationException;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import org.apache.log4j.Logger;

/**
 * Ordered key/value container kept balanced by red-black colouring.
 * <p>
 * Every missing child, and the parent of the root, is one shared black sentinel
 * owned by the tree. The sentinel is never written to after construction, so
 * deletion of a black leaf repairs the tree around the leaf while it is still
 * linked and unlinks it afterwards.
 * <p>
 * Not thread safe.
 */
public class RedBlackTree<K extends Comparable<K>, V> implements Iterable<Entry<K, V>> {
    private static final Logger LOG = Logger.getLogger(RedBlackTree.class);

    static final class Node<K, V> {
        K key;
        V value;
        Color color;
        Node<K, V> parent, left, right;

        //sentinel
        Node() {
            this.color = Color.BLACK;
            parent = left = right = this;
        }
        Node(K key, V value, Color color, Node<K, V> nil) {
            this.key = key;
            this.value = value;
            this.color = color;
            parent = left = right = nil;
        }
        boolean isRed()   { return color == Color.RED; }
        boolean isBlack() { return color == Color.BLACK; }
    }

    protected final Node<K, V> nil = new Node<>();
    protected Node<K, V> root = nil;
    protected int size;
    private final DuplicatePolicy duplicates;
    private int modCount;

    public RedBlackTree() {
        this(DuplicatePolicy.APPEND);
    }
    public RedBlackTree(DuplicatePolicy duplicates) {
        this.duplicates = checkNotNull(duplicates, "duplicates");
    }

    public int size()                       { return size; }
    public boolean isEmpty()                { return size == 0; }
    public DuplicatePolicy duplicatePolicy() { return duplicates; }
    Node<K, V> root()                       { return root; }
    Node<K, V> nil()                        { return nil; }

    /**
     * Adds {@code key -> value}. An equal key is handled per the tree's {@link DuplicatePolicy}.
     *
     * @return the value replaced under {@link DuplicatePolicy#REPLACE}, otherwise {@code null}
     */
    public V insert(K key, V value) {
        checkNotNull(key, "key");
        checkNotNull(value, "value");

        Node<K, V> parent = nil;
        Node<K, V> x = root;
        int cmp = 0;
        while(x != nil) {
            parent = x;
            cmp = key.compareTo(x.key);
            if(cmp == 0 && duplicates == DuplicatePolicy.REPLACE) {   //key exists; replace
                V old = x.value;
                x.value = value;
                if(LOG.isDebugEnabled())
                    LOG.debug("insert " + key + ": replaced existing value");
                return old;
            }
            x = cmp < 0 ? x.left : x.right;
        }

        Node<K, V> fresh = new Node<>(key, value, Color.RED, nil);
        fresh.parent = parent;
        if(parent == nil) {
            fresh.color = Color.BLACK;
            root = fresh;
        }
        else {
            if(cmp < 0)
                parent.left = fresh;
            else
                parent.right = fresh;
            insertFixup(fresh);
        }
        size++;
        modCount++;
        if(LOG.isDebugEnabled())
            LOG.debug("insert " + key + ", size " + size);
        return null;
    }

    /**
     * @return the stored value, or {@code null} if the key is absent. With
     *         duplicate keys this is the value inserted last.
     */
    public V find(K key) {
        checkNotNull(key, "key");
        Node<K, V> node = findNode(key);
        return node == nil ? null : node.value;
    }

    public boolean contains(K key) {
        checkNotNull(key, "key");
        return findNode(key) != nil;
    }

    /**
     * Removes the entry for {@code key}; with duplicate keys the one inserted last.
     *
     * @return the removed entry, or {@code null} if the key is absent (the tree is left untouched)
     */
    public Entry<K, V> delete(K key) {
        checkNotNull(key, "key");
        Node<K, V> node = findNode(key);
        if(node == nil) {   //not found
            if(LOG.isDebugEnabled())
                LOG.debug("delete " + key + ": not found");
            return null;
        }
        Entry<K, V> removed = new TreeEntry<>(node.key, node.value);

        //two children: take over the successor's entry and remove the successor instead
        if(node.left != nil && node.right != nil) {
            Node<K, V> successor = minNode(node.right);
            node.key = successor.key;
            node.value = successor.value;
            node = successor;
        }
        removeNode(node);
        if(LOG.isDebugEnabled())
            LOG.debug("delete " + key + ", size " + size);
        return removed;
    }

    public Entry<K, V> min() {
        if(root == nil)
            throw new NoSuchElementException("Empty tree");
        Node<K, V> node = minNode(root);
        return new TreeEntry<>(node.key, node.value);
    }

    public Entry<K, V> max() {
        if(root == nil)
            throw new NoSuchElementException("Empty tree");
        Node<K, V> node = maxNode(root);
        return new TreeEntry<>(node.key, node.value);
    }

    /** Removes and returns the smallest entry; among equal keys the one inserted first. */
    public Entry<K, V> pollFirst() {
        if(root == nil)
            throw new NoSuchElementException("Empty tree");
        Node<K, V> node = minNode(root);
        Entry<K, V> removed = new TreeEntry<>(node.key, node.value);
        removeNode(node);
        return removed;
    }

    /** Removes and returns the largest entry; among equal keys the one inserted last. */
    public Entry<K, V> pollLast() {
        if(root == nil)
            throw new NoSuchElementException("Empty tree");
        Node<K, V> node = maxNode(root);
        Entry<K, V> removed = new TreeEntry<>(node.key, node.value);
        removeNode(node);
        return removed;
    }

    public void clear() {
        root = nil;
        size = 0;
        modCount++;
    }

    /** Number of nodes on the longest root-to-leaf path; 0 for an empty tree. */
    public int height() {
        return height(root);
    }

    public ValidationResult validate() {
        return new TreeValidator<>(this).validate();
    }

    public boolean isValid() {
        return validate().isValid();
    }

    public String render() {
        return TreePrinter.render(this);
    }

    //  ------------- Traverse -------------

    public List<Entry<K, V>> inorder() {
        ArrayList<Entry<K, V>> snapshot = new ArrayList<>(size);
        inorderRecur(root, snapshot);
        return snapshot;
    }

    public List<Entry<K, V>> preorder() {
        ArrayList<Entry<K, V>> snapshot = new ArrayList<>(size);
        preorderRecur(root, snapshot);
        return snapshot;
    }

    public List<Entry<K, V>> postorder() {
        ArrayList<Entry<K, V>> snapshot = new ArrayList<>(size);
        postorderRecur(root, snapshot);
        return snapshot;
    }

    protected void inorderRecur(Node<K, V> node, List<Entry<K, V>> snapshot) {
        if(node == nil)
            return;
        inorderRecur(node.left, snapshot);
        snapshot.add(new TreeEntry<>(node.key, node.value));
        inorderRecur(node.right, snapshot);
    }

    protected void preorderRecur(Node<K, V> node, List<Entry<K, V>> snapshot) {
        if(node == nil)
            return;
        snapshot.add(new TreeEntry<>(node.key, node.value));
        preorderRecur(node.left, snapshot);
        preorderRecur(node.right, snapshot);
    }

    protected void postorderRecur(Node<K, V> node, List<Entry<K, V>> snapshot) {
        if(node == nil)
            return;
        postorderRecur(node.left, snapshot);
        postorderRecur(node.right, snapshot);
        snapshot.add(new TreeEntry<>(node.key, node.value));
    }

    /**
     * In-order iterator walking successor links. Each call starts a fresh walk;
     * mutating the tree during a walk fails it with {@link ConcurrentModificationException}.
     */
    @Override
    public Iterator<Entry<K, V>> iterator() {
        return new Iterator<Entry<K, V>>() {
            private Node<K, V> next = root == nil ? nil : minNode(root);
            private final int expectedModCount = modCount;

            @Override
            public boolean hasNext() {
                return next != nil;
            }

            @Override
            public Entry<K, V> next() {
                if(modCount != expectedModCount)
                    throw new ConcurrentModificationException();
                if(next == nil)
                    throw new NoSuchElementException();
                Node<K, V> current = next;
                next = successor(current);
                return new TreeEntry<>(current.key, current.value);
            }
        };
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("{");
        for(Entry<K, V> e : this) {
            if(sb.length() > 1)
                sb.append(", ");
            sb.append(e);
        }
        return sb.append('}').toString();
    }

    //  ------------- Helpers -------------

    /** Last node in key order whose key equals {@code key}, or the sentinel. */
    protected Node<K, V> findNode(K key) {
        Node<K, V> match = nil;
        Node<K, V> x = root;
        while(x != nil) {
            int cmp = key.compareTo(x.key);
            if(cmp < 0)
                x = x.left;
            else {
                if(cmp == 0)
                    match = x;
                x = x.right;
            }
        }
        return match;
    }

    protected Node<K, V> minNode(Node<K, V> node) {
        while(node.left != nil)
            node = node.left;
        return node;
    }

    protected Node<K, V> maxNode(Node<K, V> node) {
        while(node.right != nil)
            node = node.right;
        return node;
    }

    protected Node<K, V> successor(Node<K, V> node) {
        if(node.right != nil)
            return minNode(node.right);
        Node<K, V> child = node;
        Node<K, V> p = node.parent;
        while(p != nil && child == p.right) {
            child = p;
            p = p.parent;
        }
        return p;
    }

    private int height(Node<K, V> node) {
        if(node == nil)
            return 0;
        return 1 + Math.max(height(node.left), height(node.right));
    }

    private Node<K, V> requireNode(Node<K, V> node, String role, Node<K, V> of) {
        if(node == nil)
            throw new BrokenInvariantException(role + " of " + of.key + " is the sentinel");
        return node;
    }

    /**
     * Points {@code parent}'s link to {@code oldChild} at {@code newChild}; a sentinel
     * parent means {@code oldChild} is the root. Never writes the sentinel.
     */
    private void replaceChild(Node<K, V> parent, Node<K, V> oldChild, Node<K, V> newChild) {
        if(parent == nil) {
            if(root != oldChild)
                throw new BrokenInvariantException("node " + oldChild.key + " has no parent but is not the root");
            root = newChild;
        }
        else if(parent.left == oldChild)
            parent.left = newChild;
        else if(parent.right == oldChild)
            parent.right = newChild;
        else
            throw new BrokenInvariantException("node " + oldChild.key + " is not a child of its parent " + parent.key);

        if(newChild != nil)
            newChild.parent = parent;
    }

    //  ------------- Rotations -------------

    /** Lifts {@code x.right} above {@code x}. No-op if either is the sentinel. */
    @VisibleForTesting
    void rotateLeft(Node<K, V> x) {
        if(x == nil || x.right == nil)
            return;
        if(LOG.isTraceEnabled())
            LOG.trace("rotate left at " + x.key);
        Node<K, V> y = x.right;
        x.right = y.left;
        if(y.left != nil)
            y.left.parent = x;
        replaceChild(x.parent, x, y);
        y.left = x;
        x.parent = y;
    }

    /** Lifts {@code x.left} above {@code x}. No-op if either is the sentinel. */
    @VisibleForTesting
    void rotateRight(Node<K, V> x) {
        if(x == nil || x.left == nil)
            return;
        if(LOG.isTraceEnabled())
            LOG.trace("rotate right at " + x.key);
        Node<K, V> y = x.left;
        x.left = y.right;
        if(y.right != nil)
            y.right.parent = x;
        replaceChild(x.parent, x, y);
        y.right = x;
        x.parent = y;
    }

    //  ------------- Fix-up -------------

    private void insertFixup(Node<K, V> z) {
        while(z.parent.isRed()) {
            Node<K, V> parent = z.parent;
            //a red parent is never the root, so the grandparent is real
            Node<K, V> grand = requireNode(parent.parent, "grandparent", z);
            if(parent == grand.left) {
                Node<K, V> uncle = grand.right;
                if(uncle.isRed()) {
                    LOG.trace("insert fixup: recolor");
                    parent.color = Color.BLACK;
                    uncle.color = Color.BLACK;
                    grand.color = Color.RED;
                    z = grand;
                }
                else {
                    if(z == parent.right) {
                        LOG.trace("insert fixup: inner grandchild");
                        z = parent;
                        rotateLeft(z);
                    }
                    LOG.trace("insert fixup: outer grandchild");
                    z.parent.color = Color.BLACK;
                    grand.color = Color.RED;
                    rotateRight(grand);
                }
            }
            else {
                Node<K, V> uncle = grand.left;
                if(uncle.isRed()) {
                    LOG.trace("insert fixup: recolor");
                    parent.color = Color.BLACK;
                    uncle.color = Color.BLACK;
                    grand.color = Color.RED;
                    z = grand;
                }
                else {
                    if(z == parent.left) {
                        LOG.trace("insert fixup: inner grandchild");
                        z = parent;
                        rotateRight(z);
                    }
                    LOG.trace("insert fixup: outer grandchild");
                    z.parent.color = Color.BLACK;
                    grand.color = Color.RED;
                    rotateLeft(grand);
                }
            }
        }
        root.color = Color.BLACK;
    }

    // node has at most one child
    private void removeNode(Node<K, V> node) {
        Node<K, V> child = node.left != nil ? node.left : node.right;
        boolean wasBlack = node.isBlack();

        if(child != nil) {
            replaceChild(node.parent, node, child);
            if(wasBlack)
                deleteFixup(child);
        }
        else if(node.parent == nil) {   //last node
            replaceChild(nil, node, nil);
        }
        else {
            //the leaf stands in for the missing child until the tree is repaired
            if(wasBlack)
                deleteFixup(node);
            replaceChild(node.parent, node, nil);
        }
        node.parent = node.left = node.right = null;
        size--;
        modCount++;
    }

    private void deleteFixup(Node<K, V> x) {
        while(x != root && x.isBlack()) {
            Node<K, V> parent = x.parent;
            if(x == parent.left) {
                Node<K, V> w = requireNode(parent.right, "sibling", x);
                if(w.isRed()) {
                    LOG.trace("delete fixup: red sibling");
                    w.color = Color.BLACK;
                    parent.color = Color.RED;
                    rotateLeft(parent);
                    w = requireNode(parent.right, "sibling", x);
                }
                if(w.left.isBlack() && w.right.isBlack()) {
                    LOG.trace("delete fixup: black sibling, black nephews");
                    w.color = Color.RED;
                    x = parent;
                }
                else {
                    if(w.right.isBlack()) {
                        LOG.trace("delete fixup: red near nephew");
                        w.left.color = Color.BLACK;
                        w.color = Color.RED;
                        rotateRight(w);
                        w = parent.right;
                    }
                    LOG.trace("delete fixup: red far nephew");
                    w.color = parent.color;
                    parent.color = Color.BLACK;
                    w.right.color = Color.BLACK;
                    rotateLeft(parent);
                    x = root;
                }
            }
            else {
                Node<K, V> w = requireNode(parent.left, "sibling", x);
                if(w.isRed()) {
                    LOG.trace("delete fixup: red sibling");
                    w.color = Color.BLACK;
                    parent.color = Color.RED;
                    rotateRight(parent);
                    w = requireNode(parent.left, "sibling", x);
                }
                if(w.right.isBlack() && w.left.isBlack()) {
                    LOG.trace("delete fixup: black sibling, black nephews");
                    w.color = Color.RED;
                    x = parent;
                }
                else {
                    if(w.left.isBlack()) {
                        LOG.trace("delete fixup: red near nephew");
                        w.right.color = Color.BLACK;
                        w.color = Color.RED;
                        rotateLeft(w);
                        w = parent.left;
                    }
                    LOG.trace("delete fixup: red far nephew");
                    w.color = parent.color;
                    parent.color = Color.BLACK;
                    w.left.color = Color.BLACK;
                    rotateRight(parent);
                    x = root;
                }
            }
        }
        x.color = Color.BLACK;
    }
}
