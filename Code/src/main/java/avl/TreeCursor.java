package avl;

import java.util.NoSuchElementException;

import avl.AVLTree.Node;

/**
 * Bidirectional position in an {@link AVLTree}, walking the tree through parent links.
 * <p>
 * A cursor points at one node, or at nothing, which is the end position. Forward
 * cursors visit keys in non-decreasing order, reverse cursors in non-increasing order.
 * A single step costs O(log n) in the worst case, a full walk O(n).
 * <p>
 * Moving or dereferencing the end cursor throws {@link NoSuchElementException}; there
 * is no way back from the end, use the opposite-direction cursor instead. Two cursors
 * are equal only if they sit on the very same node, equal keys are not enough.
 */
public final class TreeCursor<E> {

    private Node<E> node;
    private final boolean reverse;
    private final boolean readOnly;

    TreeCursor(final Node<E> node, final boolean reverse) {
        this(node, reverse, false);
    }

    private TreeCursor(final Node<E> node, final boolean reverse, final boolean readOnly) {
        this.node = node;
        this.reverse = reverse;
        this.readOnly = readOnly;
    }

    public boolean isEnd() {
        return node == null;
    }

    public boolean isReverse() {
        return reverse;
    }

    public E get() {
        return current().value;
    }

    /**
     * Overwrites the key in place. The tree is not reordered, keeping the ordering
     * intact is up to the caller.
     */
    public void set(final E value) {
        if (readOnly) throw new UnsupportedOperationException("read-only cursor");
        if (value == null) throw new NullPointerException();
        current().value = value;
    }

    /** Node the cursor sits on. */
    public Node<E> node() {
        return current();
    }

    /** Steps to the next key in this cursor's direction; may land on the end. */
    public TreeCursor<E> increment() {
        final Node<E> n = current();
        node = reverse ? predecessor(n) : successor(n);
        return this;
    }

    /** Steps back; stepping back from the first key lands on the end. */
    public TreeCursor<E> decrement() {
        final Node<E> n = current();
        node = reverse ? successor(n) : predecessor(n);
        return this;
    }

    public TreeCursor<E> copy() {
        return new TreeCursor<>(node, reverse, readOnly);
    }

    public TreeCursor<E> asReadOnly() {
        return new TreeCursor<>(node, reverse, true);
    }

    private Node<E> current() {
        if (node == null) throw new NoSuchElementException("end cursor");
        return node;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (!(o instanceof TreeCursor)) return false;
        final TreeCursor<?> other = (TreeCursor<?>) o;
        return node == other.node && reverse == other.reverse;
    }

    @Override
    public int hashCode() {
        return 31 * System.identityHashCode(node) + (reverse ? 1 : 0);
    }

    @Override
    public String toString() {
        return (reverse ? "ReverseCursor[" : "Cursor[") + (node == null ? "end" : String.valueOf(node.value)) + "]";
    }

    //--------------------------------------------------------------------------------
    // Link walking
    //--------------------------------------------------------------------------------

    static <E> Node<E> leftmost(Node<E> n) {
        while (n.left != null) n = n.left;
        return n;
    }

    static <E> Node<E> rightmost(Node<E> n) {
        while (n.right != null) n = n.right;
        return n;
    }

    /** In-order successor of {@code n}, null past the last node. */
    static <E> Node<E> successor(final Node<E> n) {
        if (n.right != null) return leftmost(n.right);
        Node<E> child = n;
        Node<E> p = n.parent;
        while (p != null && child == p.right) {
            child = p;
            p = p.parent;
        }
        return p;
    }

    /** In-order predecessor of {@code n}, null before the first node. */
    static <E> Node<E> predecessor(final Node<E> n) {
        if (n.left != null) return rightmost(n.left);
        Node<E> child = n;
        Node<E> p = n.parent;
        while (p != null && child == p.left) {
            child = p;
            p = p.parent;
        }
        return p;
    }
}
