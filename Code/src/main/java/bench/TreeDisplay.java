package bench;

import avl.AVLTree;
import avl.AVLTree.Node;
import avl.Traversals;
import java.util.ArrayList;
import java.util.List;

/**
 * Prints an AVL tree built from the command line, sideways (root on the left, larger
 * keys on top), with the stored height of each node.
 *
 * Usage: TreeDisplay [key ...] [--erase key ...]
 * Without arguments the tree 23 -43 0 234 78 is shown before and after erasing 23 and 78.
 */
public class TreeDisplay {

    public static void main(String[] args) {
        List<Integer> inserts = new ArrayList<>();
        List<Integer> erases = new ArrayList<>();
        if (args.length == 0) {
            for (int k : new int[]{23, -43, 0, 234, 78}) inserts.add(k);
            erases.add(23);
            erases.add(78);
        } else {
            List<Integer> target = inserts;
            for (String arg : args) {
                if (arg.equals("--erase")) { target = erases; continue; }
                target.add(Integer.parseInt(arg));
            }
        }

        AVLTree<Integer> tree = new AVLTree<>();
        for (int k : inserts) tree.insert(k);
        print(tree);

        if (!erases.isEmpty()) {
            for (int k : erases) {
                if (!tree.erase(k)) System.err.printf("erase %d: not found%n", k);
            }
            System.out.println("\nafter erasing " + erases);
            print(tree);
        }
    }

    static void print(AVLTree<Integer> tree) {
        if (tree.isEmpty()) {
            System.out.println("(empty)");
            return;
        }
        StringBuilder sb = new StringBuilder();
        render(tree.root(), 0, sb);
        System.out.print(sb);

        List<Integer> pre = new ArrayList<>(), in = new ArrayList<>(), post = new ArrayList<>();
        Traversals.preOrder(tree, pre::add);
        Traversals.inOrder(tree, in::add);
        Traversals.postOrder(tree, post::add);
        System.out.printf("size=%d height=%d%n", tree.size(), tree.height());
        System.out.println("pre-order:  " + pre);
        System.out.println("in-order:   " + in);
        System.out.println("post-order: " + post);
    }

    static void render(Node<Integer> n, int depth, StringBuilder sb) {
        if (n == null) return;
        render(n.getRight(), depth + 1, sb);
        for (int i = 0; i < depth; i++) sb.append("      ");
        sb.append(n.getValue()).append(" [").append(n.getHeight()).append("]\n");
        render(n.getLeft(), depth + 1, sb);
    }
}
