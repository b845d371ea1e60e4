package twothree;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Corrupts trees through package-private fields and checks validate() notices.
 */
class ValidatorTest {

    private static Element<Integer,Integer> e(int k) {
        return new Element<>(k, k);
    }

    // (2) over (1) (3)
    private static TwoThreeTree<Integer,Integer> smallTree() {
        TwoThreeTree<Integer,Integer> t = new TwoThreeTree<>();
        for (int k : new int[]{1, 2, 3}) t.insert(k, k);
        t.validate();
        return t;
    }

    @Test
    void sizeMismatch() {
        TwoThreeTree<Integer,Integer> t = smallTree();
        t.size = 5;
        InvariantViolationException ex = assertThrows(InvariantViolationException.class, t::validate);
        assertTrue(ex.getMessage().contains("size is 5"), ex.getMessage());
    }

    @Test
    void emptyTreeWithSize() {
        TwoThreeTree<Integer,Integer> t = new TwoThreeTree<>();
        t.size = 1;
        assertThrows(InvariantViolationException.class, t::validate);
    }

    @Test
    void elementsOutOfOrderInNode() {
        TwoThreeTree<Integer,Integer> t = new TwoThreeTree<>();
        t.insert(1, 1);
        t.insert(2, 2);
        t.root.elem1 = e(3);
        InvariantViolationException ex = assertThrows(InvariantViolationException.class, t::validate);
        assertTrue(ex.getMessage().contains("out of order"), ex.getMessage());
    }

    @Test
    void childOutOfRange() {
        TwoThreeTree<Integer,Integer> t = smallTree();
        t.root.child1.elem1 = e(9);
        InvariantViolationException ex = assertThrows(InvariantViolationException.class, t::validate);
        assertTrue(ex.getMessage().contains("upper bound"), ex.getMessage());
    }

    @Test
    void grandchildOutOfRange() {
        TwoThreeTree<Integer,Integer> t = new TwoThreeTree<>();
        for (int k = 0; k < 20; k++) t.insert(k, k);
        // the smallest key, placed deep in the right half
        TwoThreeTree.Node<Integer,Integer> n = t.root.child2;
        while (n.child1 != null) n = n.child1;
        n.elem1 = e(-1);
        assertThrows(InvariantViolationException.class, t::validate);
    }

    @Test
    void leavesAtDifferentDepths() {
        TwoThreeTree<Integer,Integer> t = smallTree();
        t.root.child2 = new TwoThreeTree.Node<>(e(3), new TwoThreeTree.Node<>(e(3)), new TwoThreeTree.Node<>(e(4)));
        InvariantViolationException ex = assertThrows(InvariantViolationException.class, t::validate);
        assertTrue(ex.getMessage().contains("level"), ex.getMessage());
    }

    @Test
    void twoNodeWithThirdChild() {
        TwoThreeTree<Integer,Integer> t = smallTree();
        t.root.child3 = new TwoThreeTree.Node<>(e(4));
        InvariantViolationException ex = assertThrows(InvariantViolationException.class, t::validate);
        assertTrue(ex.getMessage().contains("child3"), ex.getMessage());
    }

    @Test
    void threeNodeMissingThirdChild() {
        TwoThreeTree<Integer,Integer> t = smallTree();
        t.root.elem2 = e(5);
        assertThrows(InvariantViolationException.class, t::validate);
    }

    @Test
    void leafWithChildren() {
        TwoThreeTree<Integer,Integer> t = smallTree();
        t.root.child1.child2 = new TwoThreeTree.Node<>(e(1));
        InvariantViolationException ex = assertThrows(InvariantViolationException.class, t::validate);
        assertTrue(ex.getMessage().contains("has children"), ex.getMessage());
    }

    @Test
    void violationIsAnIllegalStateException() {
        TwoThreeTree<Integer,Integer> t = smallTree();
        t.size = 0;
        assertThrows(IllegalStateException.class, t::validate);
    }
}
