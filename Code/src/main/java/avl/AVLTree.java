package avl;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Optional;

/**
 * Height-balanced binary search tree holding a sorted multiset of keys.
 * <p>
 * Every node keeps a back-reference to its parent, which is what lets
 * {@link TreeCursor} step through the tree without any auxiliary storage.
 * Equal keys are allowed and are routed to the left subtree on insertion.
 * <p>
 * Not thread-safe. Any erase invalidates cursors pointing at the erased node
 * and at the node whose key was moved into it.
 */
public class AVLTree<E extends Comparable<? super E>> implements Iterable<E> {
    //--------------------------------------------------------------------------------
    // Class: Node
    //--------------------------------------------------------------------------------
    public static final class Node<E> {
        E value;
        int height;
        Node<E> left;
        Node<E> right;
        Node<E> parent;   // back-reference only, never owns

        Node(final E value, final Node<E> parent) {
            this.value = value;
            this.parent = parent;
        }

        public E getValue() {
            return value;
        }

        /** 0 for a leaf. */
        public int getHeight() {
            return height;
        }

        public Node<E> getLeft() {
            return left;
        }

        public Node<E> getRight() {
            return right;
        }

        public Node<E> getParent() {
            return parent;
        }

        @Override
        public String toString() {
            return value + "(h=" + height + ")";
        }
    }

    private Node<E> root;
    private int size;
    private long rotations;

    public AVLTree() {
    }

//--------------------------------------------------------------------------------
// PUBLIC METHODS:
// - find   : Optional<Node>
// - insert : Node
// - erase  : boolean
//--------------------------------------------------------------------------------

    /** PRECONDITION: key CANNOT BE NULL **/
    public final Optional<Node<E>> find(final E key) {
        if (key == null) throw new NullPointerException();
        Node<E> n = root;
        while (n != null) {
            final int c = key.compareTo(n.value);
            if (c == 0) return Optional.of(n);
            n = (c < 0) ? n.left : n.right;
        }
        return Optional.empty();
    }

    /** PRECONDITION: key CANNOT BE NULL **/
    public final boolean contains(final E key) {
        return find(key).isPresent();
    }

    /**
     * Inserts {@code key}, keeping any equal keys already present.
     *
     * PRECONDITION: key CANNOT BE NULL
     *
     * @return the node allocated for the key; after rebalancing it still holds {@code key}
     */
    public final Node<E> insert(final E key) {
        if (key == null) throw new NullPointerException();
        size++;
        if (root == null) {
            root = new Node<>(key, null);
            return root;
        }

        Node<E> p = root;
        while (true) {
            // ties go left
            if (p.value.compareTo(key) < 0) {
                if (p.right == null) break;
                p = p.right;
            } else {
                if (p.left == null) break;
                p = p.left;
            }
        }
        final Node<E> newNode = new Node<>(key, p);
        if (p.value.compareTo(key) < 0) p.right = newNode;
        else                            p.left = newNode;

        // A single insertion grows at most one subtree by one level: once a rotation
        // fires, or a height stays put, nothing above can be out of balance.
        Node<E> n = p;
        while (n != null) {
            final int before = n.height;
            final Node<E> top = checkForRotations(n);
            if (top != n || top.height == before) break;
            n = top.parent;
        }
        return newNode;
    }

    /**
     * Removes one node holding a key equal to {@code key}.
     *
     * PRECONDITION: key CANNOT BE NULL
     *
     * @return false if no such key is present; the tree is then left untouched
     */
    public final boolean erase(final E key) {
        final Optional<Node<E>> target = find(key);
        if (!target.isPresent()) return false;
        erase(target.get());
        return true;
    }

    /**
     * Removes {@code target}, which must be a live node of this tree (as returned by
     * {@link #find} or {@link #insert}).
     */
    public final void erase(final Node<E> target) {
        if (target == null) throw new NullPointerException();

        // Pick the node that is physically unlinked. It has at most one child.
        Node<E> victim;
        if (target.left != null) {
            victim = target.left;
            while (victim.right != null) victim = victim.right;
        } else if (target.right != null) {
            victim = target.right;
            while (victim.left != null) victim = victim.left;
        } else {
            victim = target;
        }
        if (victim != target) target.value = victim.value;

        final Node<E> child = (victim.left != null) ? victim.left : victim.right;
        final Node<E> p = victim.parent;
        replaceChild(p, victim, child);
        victim.left = victim.right = victim.parent = null;
        victim.value = null;
        size--;

        // Every ancestor may lose a level, so the walk never stops early.
        Node<E> n = p;
        while (n != null) {
            n = checkForRotations(n).parent;
        }
    }

    public final void clear() {
        root = null;
        size = 0;
    }

    public final int size() {
        return size;
    }

    public final boolean isEmpty() {
        return root == null;
    }

    /** Height of the whole tree, -1 when empty. */
    public final int height() {
        return height(root);
    }

    public final Node<E> root() {
        return root;
    }

    public final Optional<E> first() {
        return (root == null) ? Optional.empty() : Optional.of(TreeCursor.leftmost(root).value);
    }

    public final Optional<E> last() {
        return (root == null) ? Optional.empty() : Optional.of(TreeCursor.rightmost(root).value);
    }

    /** Number of single rotations performed so far; a double rotation counts as two. */
    public final long rotationCount() {
        return rotations;
    }

//--------------------------------------------------------------------------------
// CURSORS
//--------------------------------------------------------------------------------

    /** Cursor on the smallest key, or the end cursor if the tree is empty. */
    public final TreeCursor<E> begin() {
        return new TreeCursor<>(root == null ? null : TreeCursor.leftmost(root), false);
    }

    public final TreeCursor<E> end() {
        return new TreeCursor<>(null, false);
    }

    /** Reverse cursor on the largest key. */
    public final TreeCursor<E> rbegin() {
        return new TreeCursor<>(root == null ? null : TreeCursor.rightmost(root), true);
    }

    public final TreeCursor<E> rend() {
        return new TreeCursor<>(null, true);
    }

    @Override
    public final Iterator<E> iterator() {
        return new CursorIterator<>(begin().asReadOnly());
    }

    public final Iterator<E> descendingIterator() {
        return new CursorIterator<>(rbegin().asReadOnly());
    }

    private static final class CursorIterator<E> implements Iterator<E> {
        private final TreeCursor<E> cursor;

        CursorIterator(final TreeCursor<E> cursor) {
            this.cursor = cursor;
        }

        @Override
        public boolean hasNext() {
            return !cursor.isEnd();
        }

        @Override
        public E next() {
            if (cursor.isEnd()) throw new NoSuchElementException();
            final E value = cursor.get();
            cursor.increment();
            return value;
        }
    }

//--------------------------------------------------------------------------------
// BALANCE UTILITIES
// - height / updateHeight / balanceFactor
// - rotateLeft / rotateRight
// - checkForRotations
//--------------------------------------------------------------------------------

    static int height(final Node<?> n) {
        return (n == null) ? -1 : n.height;
    }

    static void updateHeight(final Node<?> n) {
        n.height = 1 + Math.max(height(n.left), height(n.right));
    }

    static int balanceFactor(final Node<?> n) {
        return height(n.left) - height(n.right);
    }

    /**
     * Points whichever slot owns {@code oldChild} (a child slot of {@code p}, or the root
     * slot when {@code p} is null) at {@code newChild}.
     */
    private void replaceChild(final Node<E> p, final Node<E> oldChild, final Node<E> newChild) {
        if (p == null)                root = newChild;
        else if (p.left == oldChild)  p.left = newChild;
        else                          p.right = newChild;
        if (newChild != null) newChild.parent = p;
    }

    /** Promotes {@code n.right}; returns the new subtree root. */
    final Node<E> rotateLeft(final Node<E> n) {
        final Node<E> r = n.right;
        final Node<E> moved = r.left;

        replaceChild(n.parent, n, r);
        n.right = moved;
        if (moved != null) moved.parent = n;
        r.left = n;
        n.parent = r;

        // demoted node first, the promoted one depends on it
        updateHeight(n);
        updateHeight(r);
        rotations++;
        return r;
    }

    /** Promotes {@code n.left}; returns the new subtree root. */
    final Node<E> rotateRight(final Node<E> n) {
        final Node<E> l = n.left;
        final Node<E> moved = l.right;

        replaceChild(n.parent, n, l);
        n.left = moved;
        if (moved != null) moved.parent = n;
        l.right = n;
        n.parent = l;

        updateHeight(n);
        updateHeight(l);
        rotations++;
        return l;
    }

    /**
     * Refreshes the height of {@code n} and rotates if its balance factor left [-1, 1].
     * Returns the node now occupying the slot {@code n} occupied on entry.
     */
    final Node<E> checkForRotations(final Node<E> n) {
        updateHeight(n);
        final int bf = balanceFactor(n);
        if (bf > 1) {
            if (balanceFactor(n.left) < 0) rotateLeft(n.left);
            return rotateRight(n);
        }
        if (bf < -1) {
            if (balanceFactor(n.right) > 0) rotateRight(n.right);
            return rotateLeft(n);
        }
        return n;
    }

    /**
     *
     * DEBUG CODE (FOR TESTBED)
     *
     */

    public int sizeStructural() {
        return sizeStructural(root);
    }

    private int sizeStructural(final Node<E> n) {
        if (n == null) return 0;
        return 1 + sizeStructural(n.left) + sizeStructural(n.right);
    }
}
