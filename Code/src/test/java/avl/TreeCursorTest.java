package avl;

import org.junit.jupiter.api.Test;

import java.util.*;
import static org.junit.jupiter.api.Assertions.*;

class TreeCursorTest {

    @Test
    void empty_tree_begin_is_end() {
        AVLTree<Integer> t = new AVLTree<>();
        assertTrue(t.begin().isEnd());
        assertEquals(t.end(), t.begin());
        assertEquals(t.rend(), t.rbegin());
        assertFalse(t.iterator().hasNext());
    }

    @Test
    void forward_and_reverse_walks_visit_every_node() {
        AVLTree<Integer> t = new AVLTree<>();
        Random rnd = new Random(5);
        List<Integer> keys = new ArrayList<>();
        for (int i = 0; i < 1000; i++) {
            int k = rnd.nextInt(300) - 150;   // plenty of duplicates
            keys.add(k);
            t.insert(k);
        }
        Collections.sort(keys);

        List<Integer> forward = new ArrayList<>();
        for (TreeCursor<Integer> c = t.begin(); !c.equals(t.end()); c.increment()) forward.add(c.get());
        assertEquals(keys, forward);

        List<Integer> backward = new ArrayList<>();
        for (TreeCursor<Integer> c = t.rbegin(); !c.equals(t.rend()); c.increment()) backward.add(c.get());
        Collections.reverse(keys);
        assertEquals(keys, backward);
    }

    @Test
    void iterators_match_cursors() {
        AVLTree<String> t = new AVLTree<>();
        for (String s : new String[]{"pear", "apple", "fig", "kiwi", "apple"}) t.insert(s);

        List<String> asc = new ArrayList<>();
        for (String s : t) asc.add(s);
        assertEquals(Arrays.asList("apple", "apple", "fig", "kiwi", "pear"), asc);

        List<String> desc = new ArrayList<>();
        t.descendingIterator().forEachRemaining(desc::add);
        assertEquals(Arrays.asList("pear", "kiwi", "fig", "apple", "apple"), desc);

        Iterator<String> it = t.iterator();
        while (it.hasNext()) it.next();
        assertThrows(NoSuchElementException.class, it::next);
        assertThrows(UnsupportedOperationException.class, () -> t.iterator().remove());
    }

    @Test
    void decrement_walks_back() {
        AVLTree<Integer> t = new AVLTree<>();
        for (int i = 1; i <= 20; i++) t.insert(i);

        TreeCursor<Integer> c = t.begin();
        for (int i = 1; i < 20; i++) c.increment();
        assertEquals(20, c.get());
        for (int i = 20; i >= 1; i--) {
            assertEquals(i, c.get());
            c.decrement();
        }
        assertTrue(c.isEnd(), "stepping back from the first key lands on the end");

        TreeCursor<Integer> r = t.rbegin();
        assertEquals(20, r.get());
        r.increment();
        assertEquals(19, r.get());
        r.decrement();
        assertEquals(20, r.get());
    }

    @Test
    void end_cursor_rejects_every_move() {
        AVLTree<Integer> t = new AVLTree<>();
        t.insert(1);
        TreeCursor<Integer> end = t.end();
        assertThrows(NoSuchElementException.class, end::get);
        assertThrows(NoSuchElementException.class, end::increment);
        assertThrows(NoSuchElementException.class, end::decrement);
        assertThrows(NoSuchElementException.class, () -> t.rend().decrement());

        TreeCursor<Integer> c = t.begin().increment();
        assertTrue(c.isEnd());
        assertThrows(NoSuchElementException.class, c::increment);
    }

    @Test
    void equality_is_node_identity() {
        AVLTree<Integer> t = new AVLTree<>();
        t.insert(7);
        t.insert(7);
        TreeCursor<Integer> a = t.begin();
        TreeCursor<Integer> b = t.begin().increment();
        assertEquals(a.get(), b.get());
        assertNotEquals(a, b, "same key, different nodes");

        TreeCursor<Integer> a2 = a.copy();
        assertEquals(a, a2);
        assertEquals(a.hashCode(), a2.hashCode());
        a2.increment();
        assertEquals(b, a2);
        assertNotEquals(a, a2, "copies move independently");

        assertNotEquals(t.end(), t.rend(), "direction matters");
    }

    @Test
    void set_writes_through_unless_read_only() {
        AVLTree<Integer> t = new AVLTree<>();
        for (int k : new int[]{10, 20, 30}) t.insert(k);

        TreeCursor<Integer> c = t.begin().increment();
        c.set(21);
        assertEquals(Arrays.asList(10, 21, 30), Traversals.toList(t));
        assertTrue(t.contains(21));

        TreeCursor<Integer> ro = c.asReadOnly();
        assertEquals(21, ro.get());
        assertThrows(UnsupportedOperationException.class, () -> ro.set(22));
        assertEquals(c, ro);
    }

    @Test
    void cursor_survives_erase_of_other_nodes() {
        AVLTree<Integer> t = new AVLTree<>();
        for (int i = 0; i < 100; i++) t.insert(i);
        AVLTree.Node<Integer> n = t.insert(1000);
        TreeCursor<Integer> c = t.rbegin();
        assertSame(n, c.node());

        // erasing leaves away from the cursor keeps it usable
        for (int i = 0; i < 50; i += 2) assertTrue(t.erase(i));
        TreeChecks.assertValid(t);
        assertEquals(1000, c.get());
        c.increment();
        assertEquals(99, c.get());
    }
}
