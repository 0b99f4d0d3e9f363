package avl;

import avl.AVLTree.Node;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Structural checks recomputed from scratch, for tests only.
 */
final class TreeChecks {

    private TreeChecks() {
    }

    /** Stored height of every node equals the height recomputed from its children. */
    static boolean areHeightsCorrect(final AVLTree<?> tree) {
        return recomputeHeight(tree.root()) != Integer.MIN_VALUE;
    }

    private static int recomputeHeight(final Node<?> n) {
        if (n == null) return -1;
        final int l = recomputeHeight(n.left);
        final int r = recomputeHeight(n.right);
        if (l == Integer.MIN_VALUE || r == Integer.MIN_VALUE) return Integer.MIN_VALUE;
        final int h = 1 + Math.max(l, r);
        return (h == n.height) ? h : Integer.MIN_VALUE;
    }

    /** |balance factor| <= 1 everywhere, using stored heights. */
    static boolean isTreeBalanced(final AVLTree<?> tree) {
        return isTreeBalanced(tree.root());
    }

    private static boolean isTreeBalanced(final Node<?> n) {
        if (n == null) return true;
        return Math.abs(AVLTree.balanceFactor(n)) <= 1 && isTreeBalanced(n.left) && isTreeBalanced(n.right);
    }

    /** Left keys <= node key <= right keys, for every node. */
    static <E extends Comparable<? super E>> boolean isOrdered(final AVLTree<E> tree) {
        return isOrdered(tree.root(), null, null);
    }

    private static <E extends Comparable<? super E>> boolean isOrdered(final Node<E> n, final E lo, final E hi) {
        if (n == null) return true;
        if (lo != null && n.value.compareTo(lo) < 0) return false;
        if (hi != null && n.value.compareTo(hi) > 0) return false;
        return isOrdered(n.left, lo, n.value) && isOrdered(n.right, n.value, hi);
    }

    static boolean areParentsConsistent(final AVLTree<?> tree) {
        final Node<?> root = tree.root();
        return root == null || (root.parent == null && areParentsConsistent(root));
    }

    private static boolean areParentsConsistent(final Node<?> n) {
        if (n.left != null && (n.left.parent != n || !areParentsConsistent(n.left))) return false;
        if (n.right != null && (n.right.parent != n || !areParentsConsistent(n.right))) return false;
        return true;
    }

    static <E extends Comparable<? super E>> void assertValid(final AVLTree<E> tree) {
        assertTrue(areHeightsCorrect(tree), "stored heights");
        assertTrue(isTreeBalanced(tree), "balance factors");
        assertTrue(isOrdered(tree), "search order");
        assertTrue(areParentsConsistent(tree), "parent links");
        assertEquals(tree.sizeStructural(), tree.size(), "size counter");
        assertEquals(tree.root() == null, tree.isEmpty(), "isEmpty");
    }
}
