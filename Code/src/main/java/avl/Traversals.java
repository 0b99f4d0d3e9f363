package avl;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

import avl.AVLTree.Node;

/**
 * Depth-first dumps of an {@link AVLTree} into a caller-supplied sink, e.g. {@code list::add}.
 * All three walks use an explicit stack.
 */
public final class Traversals {

    private Traversals() {
    }

    public static <E extends Comparable<? super E>> void preOrder(final AVLTree<E> tree, final Consumer<? super E> sink) {
        if (tree.root() == null) return;
        final ArrayDeque<Node<E>> stack = new ArrayDeque<>();
        stack.push(tree.root());
        while (!stack.isEmpty()) {
            final Node<E> n = stack.pop();
            sink.accept(n.value);
            if (n.right != null) stack.push(n.right);
            if (n.left != null)  stack.push(n.left);
        }
    }

    public static <E extends Comparable<? super E>> void inOrder(final AVLTree<E> tree, final Consumer<? super E> sink) {
        final ArrayDeque<Node<E>> stack = new ArrayDeque<>();
        Node<E> n = tree.root();
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

    public static <E extends Comparable<? super E>> void postOrder(final AVLTree<E> tree, final Consumer<? super E> sink) {
        final ArrayDeque<Node<E>> stack = new ArrayDeque<>();
        Node<E> n = tree.root();
        Node<E> lastVisited = null;
        while (n != null || !stack.isEmpty()) {
            if (n != null) {
                stack.push(n);
                n = n.left;
                continue;
            }
            final Node<E> top = stack.peek();
            if (top.right != null && top.right != lastVisited) {
                n = top.right;
            } else {
                sink.accept(top.value);
                lastVisited = stack.pop();
            }
        }
    }

    public static <E extends Comparable<? super E>> List<E> toList(final AVLTree<E> tree) {
        final List<E> out = new ArrayList<>(tree.size());
        inOrder(tree, out::add);
        return out;
    }
}
