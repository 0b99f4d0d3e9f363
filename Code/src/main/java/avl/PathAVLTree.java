package avl;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.function.Consumer;

/**
 * {@link AVLTree} without parent links.
 * <p>
 * Each mutation records the nodes it descends through and rebalances by walking that
 * path backwards; the slot owning {@code path[i]} is a child slot of {@code path[i-1]},
 * or the root slot for {@code i == 0}. Nodes are one reference smaller, the price is
 * that positions cannot be held on to, so there are no cursors here.
 */
public class PathAVLTree<E extends Comparable<? super E>> {
    //--------------------------------------------------------------------------------
    // Class: Node
    //--------------------------------------------------------------------------------
    static final class Node<E> {
        E value;
        int height;
        Node<E> left;
        Node<E> right;

        Node(final E value) {
            this.value = value;
        }
    }

    private Node<E> root;
    private int size;

    public PathAVLTree() {
    }

//--------------------------------------------------------------------------------
// PUBLIC METHODS:
// - contains : boolean
// - insert   : void
// - erase    : boolean
//--------------------------------------------------------------------------------

    /** PRECONDITION: key CANNOT BE NULL **/
    public final boolean contains(final E key) {
        if (key == null) throw new NullPointerException();
        Node<E> n = root;
        while (n != null) {
            final int c = key.compareTo(n.value);
            if (c == 0) return true;
            n = (c < 0) ? n.left : n.right;
        }
        return false;
    }

    /** PRECONDITION: key CANNOT BE NULL **/
    public final void insert(final E key) {
        if (key == null) throw new NullPointerException();
        size++;
        if (root == null) {
            root = new Node<>(key);
            return;
        }

        final ArrayList<Node<E>> path = new ArrayList<>();
        Node<E> p = root;
        while (true) {
            path.add(p);
            final Node<E> next = (p.value.compareTo(key) < 0) ? p.right : p.left;
            if (next == null) break;
            p = next;
        }
        if (p.value.compareTo(key) < 0) p.right = new Node<>(key);
        else                            p.left = new Node<>(key);

        for (int i = path.size() - 1; i >= 0; i--) {
            final Node<E> n = path.get(i);
            final int before = n.height;
            final Node<E> top = checkForRotations(n);
            install(path, i, n, top);
            if (top != n || top.height == before) break;
        }
    }

    /**
     * Removes one node holding a key equal to {@code key}.
     *
     * PRECONDITION: key CANNOT BE NULL
     */
    public final boolean erase(final E key) {
        if (key == null) throw new NullPointerException();

        final ArrayList<Node<E>> path = new ArrayList<>();
        Node<E> target = root;
        while (target != null) {
            final int c = key.compareTo(target.value);
            if (c == 0) break;
            path.add(target);
            target = (c < 0) ? target.left : target.right;
        }
        if (target == null) return false;

        Node<E> victim = target;
        if (target.left != null) {
            path.add(target);
            victim = target.left;
            while (victim.right != null) {
                path.add(victim);
                victim = victim.right;
            }
        } else if (target.right != null) {
            path.add(target);
            victim = target.right;
            while (victim.left != null) {
                path.add(victim);
                victim = victim.left;
            }
        }
        if (victim != target) target.value = victim.value;

        final Node<E> child = (victim.left != null) ? victim.left : victim.right;
        install(path, path.size(), victim, child);
        victim.left = victim.right = null;
        victim.value = null;
        size--;

        for (int i = path.size() - 1; i >= 0; i--) {
            final Node<E> n = path.get(i);
            install(path, i, n, checkForRotations(n));
        }
        return true;
    }

    public final void inOrder(final Consumer<? super E> sink) {
        final ArrayDeque<Node<E>> stack = new ArrayDeque<>();
        Node<E> n = root;
        while (n != null || !stack.isEmpty()) {
            while (n != null) {
                stack.push(n);
                n = n.left;
            }
            n = stack.pop();
            sink.accept(n.value);
            n = n.right;
        }
    }

    public final int size() {
        return size;
    }

    public final boolean isEmpty() {
        return root == null;
    }

    public final int height() {
        return height(root);
    }

    public final void clear() {
        root = null;
        size = 0;
    }

//--------------------------------------------------------------------------------
// BALANCE UTILITIES
//--------------------------------------------------------------------------------

    /** Puts {@code repl} into the slot owning {@code old}, where {@code old} sits at {@code path[i]}. */
    private void install(final ArrayList<Node<E>> path, final int i, final Node<E> old, final Node<E> repl) {
        if (i == 0) {
            root = repl;
            return;
        }
        final Node<E> p = path.get(i - 1);
        if (p.left == old) p.left = repl;
        else               p.right = repl;
    }

    private static int height(final Node<?> n) {
        return (n == null) ? -1 : n.height;
    }

    private static void updateHeight(final Node<?> n) {
        n.height = 1 + Math.max(height(n.left), height(n.right));
    }

    private static int balanceFactor(final Node<?> n) {
        return height(n.left) - height(n.right);
    }

    private static <E> Node<E> rotateLeft(final Node<E> n) {
        final Node<E> r = n.right;
        n.right = r.left;
        r.left = n;
        updateHeight(n);
        updateHeight(r);
        return r;
    }

    private static <E> Node<E> rotateRight(final Node<E> n) {
        final Node<E> l = n.left;
        n.left = l.right;
        l.right = n;
        updateHeight(n);
        updateHeight(l);
        return l;
    }

    /** Returns the root of the subtree formerly rooted at {@code n}; the caller relinks it. */
    private static <E> Node<E> checkForRotations(final Node<E> n) {
        updateHeight(n);
        final int bf = balanceFactor(n);
        if (bf > 1) {
            if (balanceFactor(n.left) < 0) n.left = rotateLeft(n.left);
            return rotateRight(n);
        }
        if (bf < -1) {
            if (balanceFactor(n.right) > 0) n.right = rotateRight(n.right);
            return rotateLeft(n);
        }
        return n;
    }

    /**
     *
     * DEBUG CODE (FOR TESTBED)
     *
     */

    /** Recomputes every height from scratch and compares it with the stored one. */
    public boolean areHeightsCorrect() {
        return recomputeHeight(root) != Integer.MIN_VALUE;
    }

    private static int recomputeHeight(final Node<?> n) {
        if (n == null) return -1;
        final int l = recomputeHeight(n.left);
        final int r = recomputeHeight(n.right);
        if (l == Integer.MIN_VALUE || r == Integer.MIN_VALUE) return Integer.MIN_VALUE;
        final int h = 1 + Math.max(l, r);
        return (h == n.height) ? h : Integer.MIN_VALUE;
    }

    public boolean isTreeBalanced() {
        return isTreeBalanced(root);
    }

    private static boolean isTreeBalanced(final Node<?> n) {
        if (n == null) return true;
        return Math.abs(balanceFactor(n)) <= 1 && isTreeBalanced(n.left) && isTreeBalanced(n.right);
    }

    public int sizeStructural() {
        return sizeStructural(root);
    }

    private int sizeStructural(final Node<E> n) {
        if (n == null) return 0;
        return 1 + sizeStructural(n.left) + sizeStructural(n.right);
    }
}
