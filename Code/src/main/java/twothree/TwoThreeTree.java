package twothree;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-memory 2-3 tree mapping keys to values.
 *
 * Nodes carry no parent pointers. Insert and delete recurse down to a leaf and
 * restructure ancestors on the way back: splits travel up as {@link InsertResult}
 * return values, holes travel up through the {@link DeleteState} shared by the
 * frames of one delete call.
 *
 * Duplicate keys are stored side by side. An equal key descends to the left.
 *
 * Not thread-safe.
 */
public class TwoThreeTree<K extends Comparable<? super K>, V> {
    private static final Logger logger = LoggerFactory.getLogger(TwoThreeTree.class);

    //--------------------------------------------------------------------------------
    // Class: Node
    //--------------------------------------------------------------------------------
    protected final static class Node<E extends Comparable<? super E>, V> {
        Element<E,V> elem1;
        Element<E,V> elem2;     // null for a 2-node
        Node<E,V> child1;       // null for a leaf
        Node<E,V> child2;
        Node<E,V> child3;       // only set on an internal 3-node

        Node(final Element<E,V> elem1) {
            this.elem1 = elem1;
        }

        Node(final Element<E,V> elem1, final Node<E,V> child1, final Node<E,V> child2) {
            this.elem1 = elem1;
            this.child1 = child1;
            this.child2 = child2;
        }

        boolean isLeaf() {
            return child1 == null;
        }

        // 2-node -> 3-node, new element and subtree go on the left
        void addLeft(final Element<E,V> elem, final Node<E,V> child) {
            elem2 = elem1;
            elem1 = elem;
            child3 = child2;
            child2 = child1;
            child1 = child;
        }

        // 2-node -> 3-node, new element and subtree go on the right
        void addRight(final Element<E,V> elem, final Node<E,V> child) {
            elem2 = elem;
            child3 = child;
        }

        // 3-node -> 2-node, drops elem1 and child1; returns the dropped element
        Element<E,V> trimLeft() {
            final Element<E,V> removed = elem1;
            elem1 = elem2;
            elem2 = null;
            child1 = child2;
            child2 = child3;
            child3 = null;
            return removed;
        }

        // 3-node -> 2-node, drops elem2 and child3; returns the dropped element
        Element<E,V> trimRight() {
            final Element<E,V> removed = elem2;
            elem2 = null;
            child3 = null;
            return removed;
        }
    }

    //--------------------------------------------------------------------------------
    // Class: InsertResult, Absorbed, Split
    //--------------------------------------------------------------------------------
    protected static abstract class InsertResult<E extends Comparable<? super E>, V> {
    }

    // The subtree kept its height; nothing left for the caller to do.
    protected final static class Absorbed<E extends Comparable<? super E>, V> extends InsertResult<E,V> {
    }

    // The subtree overflowed: the caller must replace it by promoted, left and right.
    protected final static class Split<E extends Comparable<? super E>, V> extends InsertResult<E,V> {
        final Element<E,V> promoted;
        final Node<E,V> left;
        final Node<E,V> right;

        Split(final Element<E,V> promoted, final Node<E,V> left, final Node<E,V> right) {
            this.promoted = promoted;
            this.left = left;
            this.right = right;
        }

        Node<E,V> toNode() {
            return new Node<E,V>(promoted, left, right);
        }
    }

    //--------------------------------------------------------------------------------
    // Class: DeletePhase, Downwards, FixHole, Done, DeleteState
    //--------------------------------------------------------------------------------
    protected static abstract class DeletePhase {
    }

    // Still searching for the key.
    protected final static class Downwards extends DeletePhase {
    }

    // The child just visited has no element left; its parent must borrow or merge.
    protected final static class FixHole extends DeletePhase {
    }

    protected final static class Done extends DeletePhase {
        final boolean found;

        Done(final boolean found) {
            this.found = found;
        }
    }

    private static final DeletePhase DOWNWARDS = new Downwards();
    private static final DeletePhase FIX_HOLE = new FixHole();
    private static final DeletePhase FOUND = new Done(true);
    private static final DeletePhase NOT_FOUND = new Done(false);

    protected final static class DeleteState<E extends Comparable<? super E>, V> {
        final E key;
        DeletePhase phase = DOWNWARDS;
        Element<E,V> predecessor;

        DeleteState(final E key) {
            this.key = key;
        }
    }

    //--------------------------------------------------------------------------------
    // DICTIONARY
    //--------------------------------------------------------------------------------
    Node<K,V> root;
    int size;

    public TwoThreeTree() {
    }

    //--------------------------------------------------------------------------------
    // PUBLIC METHODS:
    // - find / get / containsKey
    // - insert
    // - delete
    // - size / isEmpty / height
    //--------------------------------------------------------------------------------

    /**
     * Returns the element stored under {@code key}, or null if there is none.
     * With duplicate keys any one of them may be returned.
     * PRECONDITION: key CANNOT BE NULL
     */
    public final Element<K,V> find(final K key) {
        if (key == null) throw new NullPointerException();
        Node<K,V> node = root;
        while (node != null) {
            final int c1 = key.compareTo(node.elem1.key);
            if (c1 == 0) return node.elem1;
            if (c1 < 0) {
                node = node.child1;
            } else if (node.elem2 == null) {
                node = node.child2;
            } else {
                final int c2 = key.compareTo(node.elem2.key);
                if (c2 == 0) return node.elem2;
                node = (c2 < 0) ? node.child2 : node.child3;
            }
        }
        return null;
    }

    /** PRECONDITION: key CANNOT BE NULL **/
    public final V get(final K key) {
        final Element<K,V> element = find(key);
        return (element != null) ? element.value : null;
    }

    /** PRECONDITION: key CANNOT BE NULL **/
    public final boolean containsKey(final K key) {
        return find(key) != null;
    }

    /** PRECONDITION: key CANNOT BE NULL **/
    public final void insert(final K key, final V value) {
        insert(new Element<K,V>(key, value));
    }

    /**
     * Adds an element. The size always grows by one, an element with an equal key
     * is kept next to the existing one rather than replaced.
     */
    public final void insert(final Element<K,V> element) {
        if (element == null) throw new NullPointerException();
        if (root == null) {
            root = new Node<K,V>(element);
        } else {
            final InsertResult<K,V> result = insertNode(root, element);
            if (result.getClass() == Split.class) {
                root = ((Split<K,V>) result).toNode();
                if (logger.isDebugEnabled()) {
                    logger.debug("Root split on key {}, height is now {}", element.key, height());
                }
            }
        }
        size++;
    }

    /**
     * Removes one element with the given key.
     *
     * PRECONDITION: key CANNOT BE NULL
     *
     * @return true if an element was found and removed
     */
    public final boolean delete(final K key) {
        if (key == null) throw new NullPointerException();
        if (root == null) return false;

        final DeleteState<K,V> state = new DeleteState<K,V>(key);
        deleteNode(root, state);

        final DeletePhase phase = state.phase;
        if (phase.getClass() == Done.class) {
            final boolean found = ((Done) phase).found;
            if (found) size--;
            return found;
        }
        if (phase.getClass() == FixHole.class) {
            // the root has no element left, its only subtree (if any) takes over
            root = root.child1;
            size--;
            if (root == null) {
                logger.debug("Last element {} deleted, tree is empty", key);
            } else if (logger.isDebugEnabled()) {
                logger.debug("Root merged on delete of {}, height is now {}", key, height());
            }
            return true;
        }
        throw new AssertionError("delete(" + key + ") finished in phase " + phase.getClass().getSimpleName());
    }

    public final int size() {
        return size;
    }

    public final boolean isEmpty() {
        return root == null;
    }

    /** Number of levels, 0 when empty. All leaves sit on the last one. */
    public final int height() {
        int height = 0;
        for (Node<K,V> node = root; node != null; node = node.child1) {
            height++;
        }
        return height;
    }

    //--------------------------------------------------------------------------------
    // PRIVATE METHODS
    // - insertNode
    // - deleteNode
    // - fixHole
    // - findPredecessor
    //--------------------------------------------------------------------------------

    private static <E extends Comparable<? super E>, T> InsertResult<E,T> insertNode(final Node<E,T> node, final Element<E,T> element) {
        if (!node.isLeaf()) {
            if (element.key.compareTo(node.elem1.key) <= 0) {
                final InsertResult<E,T> result = insertNode(node.child1, element);
                if (result.getClass() != Split.class) return result;
                final Split<E,T> split = (Split<E,T>) result;

                if (node.elem2 == null) {
                    //    (a)              (p, a)
                    //  /    \      =>    /  |   \
                    // split (b)         l   r   (b)
                    node.addLeft(split.promoted, split.left);
                    node.child2 = split.right;
                    return new Absorbed<E,T>();
                }
                //      (a,b)                    (a)
                //    /   |   \      =>       /       \
                // split (c)  (d)           (p)       (b)
                //                         /   \     /   \
                //                        l     r  (c)   (d)
                final Node<E,T> right = new Node<E,T>(node.elem2, node.child2, node.child3);
                return new Split<E,T>(node.elem1, split.toNode(), right);
            }

            if (node.elem2 == null || element.key.compareTo(node.elem2.key) <= 0) {
                final InsertResult<E,T> result = insertNode(node.child2, element);
                if (result.getClass() != Split.class) return result;
                final Split<E,T> split = (Split<E,T>) result;

                if (node.elem2 == null) {
                    //   (a)              (a, p)
                    //  /   \      =>    /  |   \
                    // (b) split       (b)  l    r
                    node.child2 = split.left;
                    node.addRight(split.promoted, split.right);
                    return new Absorbed<E,T>();
                }
                //     (a,b)                   (p)
                //   /   |   \      =>      /       \
                // (c) split (d)          (a)       (b)
                //                       /   \     /   \
                //                     (c)    l   r    (d)
                final Node<E,T> left = new Node<E,T>(node.elem1, node.child1, split.left);
                final Node<E,T> right = new Node<E,T>(node.elem2, split.right, node.child3);
                return new Split<E,T>(split.promoted, left, right);
            }

            final InsertResult<E,T> result = insertNode(node.child3, element);
            if (result.getClass() != Split.class) return result;
            final Split<E,T> split = (Split<E,T>) result;
            //    (a,b)                    (b)
            //   /  |  \        =>      /       \
            // (c) (d) split          (a)       (p)
            //                       /   \     /   \
            //                     (c)  (d)   l     r
            final Node<E,T> left = new Node<E,T>(node.elem1, node.child1, node.child2);
            return new Split<E,T>(node.elem2, left, split.toNode());
        }

        // leaf
        if (node.elem2 != null) {
            if (element.key.compareTo(node.elem1.key) < 0) {
                return new Split<E,T>(node.elem1, new Node<E,T>(element), new Node<E,T>(node.elem2));
            }
            if (element.key.compareTo(node.elem2.key) < 0) {
                return new Split<E,T>(element, new Node<E,T>(node.elem1), new Node<E,T>(node.elem2));
            }
            return new Split<E,T>(node.elem2, new Node<E,T>(node.elem1), new Node<E,T>(element));
        }
        if (node.elem1.key.compareTo(element.key) <= 0) {
            node.elem2 = element;
        } else {
            node.elem2 = node.elem1;
            node.elem1 = element;
        }
        return new Absorbed<E,T>();
    }

    private static <E extends Comparable<? super E>, T> void deleteNode(final Node<E,T> node, final DeleteState<E,T> state) {
        if (node.isLeaf()) {
            if (state.key.compareTo(node.elem1.key) == 0) {
                if (node.elem2 != null) {
                    node.elem1 = node.elem2;
                    node.elem2 = null;
                    state.phase = FOUND;
                } else {
                    state.phase = FIX_HOLE;
                }
                return;
            }
            if (node.elem2 != null && state.key.compareTo(node.elem2.key) == 0) {
                node.elem2 = null;
                state.phase = FOUND;
                return;
            }
            state.phase = NOT_FOUND;
            return;
        }

        final int childNum;
        final int c1 = state.key.compareTo(node.elem1.key);
        if (c1 < 0) {
            deleteNode(node.child1, state);
            childNum = 1;
        } else if (c1 == 0) {
            // internal match: replace with the in-order predecessor
            findPredecessor(node.child1, state);
            node.elem1 = state.predecessor;
            childNum = 1;
        } else if (node.elem2 == null) {
            deleteNode(node.child2, state);
            childNum = 2;
        } else {
            final int c2 = state.key.compareTo(node.elem2.key);
            if (c2 < 0) {
                deleteNode(node.child2, state);
                childNum = 2;
            } else if (c2 == 0) {
                findPredecessor(node.child2, state);
                node.elem2 = state.predecessor;
                childNum = 2;
            } else {
                deleteNode(node.child3, state);
                childNum = 3;
            }
        }
        fixHole(node, childNum, state);
    }

    // Removes the largest element under node into state.predecessor.
    private static <E extends Comparable<? super E>, T> void findPredecessor(final Node<E,T> node, final DeleteState<E,T> state) {
        if (node.child3 != null) {
            findPredecessor(node.child3, state);
            fixHole(node, 3, state);
        } else if (node.child2 != null) {
            findPredecessor(node.child2, state);
            fixHole(node, 2, state);
        } else if (node.elem2 != null) {
            state.predecessor = node.elem2;
            node.elem2 = null;
            state.phase = FOUND;
        } else {
            state.predecessor = node.elem1;
            state.phase = FIX_HOLE;
        }
    }

    /**
     * Upward half of a delete. If the child at {@code childNum} reported a hole,
     * either borrow an element from an adjacent 3-node sibling (the hole is gone),
     * or merge the hole with a 2-node sibling and the separating element of
     * {@code node}. A merge in a 3-node is absorbed; a merge in a 2-node leaves
     * {@code node} itself as a hole whose only subtree is child1.
     */
    private static <E extends Comparable<? super E>, T> void fixHole(final Node<E,T> node, final int childNum, final DeleteState<E,T> state) {
        final Class<? extends DeletePhase> phase = state.phase.getClass();
        if (phase == Done.class) return;
        if (phase != FixHole.class) {
            throw new AssertionError("Hole fixing reached in phase " + phase.getSimpleName());
        }

        final Node<E,T> child1 = node.child1;
        final Node<E,T> child2 = node.child2;

        if (node.elem2 == null) {
            if (childNum == 1) {
                if (child2.elem2 == null) {
                    //   (a)             (o)
                    //  /   \      =>     |
                    // (o)  (b)         (a,b)
                    //  |   / \         / | \
                    // (c) (d) (e)    (c)(d)(e)
                    child2.addLeft(node.elem1, child1.child1);
                    node.child1 = child2;
                    node.child2 = null;
                    return;
                }
                //   (a)                (b)
                //  /   \      =>     /     \
                // (o)  (b,c)       (a)     (c)
                //  |   / | \       / \     / \
                // (d) (e)(f)(g)  (d) (e) (f) (g)
                child1.elem1 = node.elem1;
                child1.child2 = child2.child1;
                node.elem1 = child2.trimLeft();
            } else {
                if (child1.elem2 == null) {
                    //    (a)             (o)
                    //   /   \     =>      |
                    // (b)   (o)         (b,a)
                    // / \    |          / | \
                    //        (c)            (c)
                    child1.addRight(node.elem1, child2.child1);
                    node.child2 = null;
                    return;
                }
                //     (a)               (c)
                //    /   \      =>     /   \
                //  (b,c)  (o)        (b)   (a)
                //  / | \   |         / \   / \
                // (d)(e)(f)(g)     (d)(e)(f) (g)
                child2.elem1 = node.elem1;
                child2.child2 = child2.child1;
                child2.child1 = child1.child3;
                node.elem1 = child1.trimRight();
            }
            state.phase = FOUND;
            return;
        }

        final Node<E,T> child3 = node.child3;
        if (childNum == 1) {
            if (child2.elem2 == null) {
                //     (a,b)              (b)
                //    /  |  \            /   \
                //  (o) (c)  ..   =>  (a,c)   ..
                //   |  / \           / | \
                child2.addLeft(node.elem1, child1.child1);
                node.trimLeft();
            } else {
                //     (a,b)                (c,b)
                //    /  |   \             /  |  \
                //  (o) (c,d) ..   =>    (a) (d)  ..
                child1.elem1 = node.elem1;
                child1.child2 = child2.child1;
                node.elem1 = child2.trimLeft();
            }
        } else if (childNum == 2) {
            if (child1.elem2 == null) {
                //     (a,b)              (b)
                //    /  |  \            /   \
                //  (c) (o)  ..   =>  (c,a)   ..
                child1.addRight(node.elem1, child2.child1);
                node.elem1 = node.elem2;
                node.elem2 = null;
                node.child2 = child3;
                node.child3 = null;
            } else {
                //     (a,b)              (d,b)
                //    /  |  \            /  |  \
                // (c,d) (o) ..   =>   (c) (a)  ..
                child2.elem1 = node.elem1;
                child2.child2 = child2.child1;
                child2.child1 = child1.child3;
                node.elem1 = child1.trimRight();
            }
        } else {
            if (child2.elem2 == null) {
                //     (a,b)            (a)
                //    /  |  \          /   \
                //  ..  (c) (o)  =>  ..   (c,b)
                child2.addRight(node.elem2, child3.child1);
                node.elem2 = null;
                node.child3 = null;
            } else {
                //     (a,b)             (a,d)
                //    /  |   \          /  |  \
                //  .. (c,d) (o)  =>  ..  (c) (b)
                child3.elem1 = node.elem2;
                child3.child2 = child3.child1;
                child3.child1 = child2.child3;
                node.elem2 = child2.trimRight();
            }
        }
        state.phase = FOUND;
    }

    //--------------------------------------------------------------------------------
    // DEBUG CODE
    // - validate
    // - dump / print
    //--------------------------------------------------------------------------------

    private static final class ValidateState {
        int leafLevel = -1;
        int elements;
    }

    /**
     * Walks the whole tree and checks element order, child ranges, child counts,
     * leaf depth and the element count.
     *
     * @throws InvariantViolationException on the first broken invariant
     */
    public void validate() {
        if (root == null) {
            if (size != 0) throw new InvariantViolationException("Empty tree reports size " + size);
            return;
        }
        final ValidateState state = new ValidateState();
        validateNode(root, 0, null, null, state);
        if (state.elements != size) {
            throw new InvariantViolationException("Counted " + state.elements + " elements, size is " + size);
        }
    }

    // lower and upper are inclusive, null means unbounded
    private void validateNode(final Node<K,V> node, final int level, final K lower, final K upper, final ValidateState state) {
        if (node.elem1 == null) throw new InvariantViolationException("Node without elements at level " + level);
        checkRange(node.elem1.key, lower, upper);
        state.elements++;

        if (node.elem2 != null) {
            if (node.elem1.key.compareTo(node.elem2.key) > 0) {
                throw new InvariantViolationException("Elements out of order: " + node.elem1.key + " > " + node.elem2.key);
            }
            checkRange(node.elem2.key, lower, upper);
            state.elements++;
        }

        if (node.isLeaf()) {
            if (node.child2 != null || node.child3 != null) {
                throw new InvariantViolationException("Leaf " + node.elem1.key + " has children");
            }
            if (state.leafLevel == -1) {
                state.leafLevel = level;
            } else if (state.leafLevel != level) {
                throw new InvariantViolationException("Leaf " + node.elem1.key + " at level " + level
                        + ", expected " + state.leafLevel);
            }
            return;
        }

        if (node.child2 == null) {
            throw new InvariantViolationException("Internal node " + node.elem1.key + " has no child2");
        }
        if (node.elem2 == null) {
            if (node.child3 != null) {
                throw new InvariantViolationException("2-node " + node.elem1.key + " has a child3");
            }
            validateNode(node.child1, level + 1, lower, node.elem1.key, state);
            validateNode(node.child2, level + 1, node.elem1.key, upper, state);
            return;
        }
        if (node.child3 == null) {
            throw new InvariantViolationException("3-node " + node.elem1.key + "," + node.elem2.key + " has no child3");
        }
        validateNode(node.child1, level + 1, lower, node.elem1.key, state);
        validateNode(node.child2, level + 1, node.elem1.key, node.elem2.key, state);
        validateNode(node.child3, level + 1, node.elem2.key, upper, state);
    }

    private void checkRange(final K key, final K lower, final K upper) {
        if (lower != null && key.compareTo(lower) < 0) {
            throw new InvariantViolationException("Key " + key + " is below its lower bound " + lower);
        }
        if (upper != null && key.compareTo(upper) > 0) {
            throw new InvariantViolationException("Key " + key + " is above its upper bound " + upper);
        }
    }

    /** Textual structure, one node per line, children indented under their parent. */
    public String dump() {
        if (root == null) return "Empty tree\n";
        final StringBuilder sb = new StringBuilder();
        sb.append("Tree(").append(size).append("):\n");
        dumpNode(root, 0, sb);
        return sb.toString();
    }

    private void dumpNode(final Node<K,V> node, final int indent, final StringBuilder sb) {
        for (int i = 0; i < indent; i++) sb.append("| ");
        sb.append("Element: ").append(node.elem1.key);
        if (node.elem2 != null) sb.append(' ').append(node.elem2.key);
        sb.append('\n');
        if (node.child1 != null) dumpNode(node.child1, indent + 1, sb);
        if (node.child2 != null) dumpNode(node.child2, indent + 1, sb);
        if (node.child3 != null) dumpNode(node.child3, indent + 1, sb);
    }

    public void print() {
        System.out.print(dump());
    }
}
