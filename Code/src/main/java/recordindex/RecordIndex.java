package recordindex;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Unbalanced binary search tree indexing records by CPF. Each node keeps the
 * position of the record in the external {@link RecordSequence}, so the index and
 * the record store stay decoupled.
 * <p>
 * Every descent and traversal is iterative: a tree built from sorted keys has
 * linear height and must not exhaust the call stack.
 * <p>
 * Not thread safe. Callers serialize access.
 */
public class RecordIndex {
    private static final Logger LOGGER = LoggerFactory.getLogger(RecordIndex.class);

    private IndexNode root;
    private int size;

    public RecordIndex() {
        this.root = null;
        this.size = 0;
    }

    /** Indexes every record of {@code sequence} at its own position. */
    public static RecordIndex of(final RecordSequence sequence) {
        checkNotNull(sequence, "sequence");
        final RecordIndex index = new RecordIndex();
        for (int pos = 0; pos < sequence.size(); pos++) {
            index.insert(sequence.get(pos), pos);
        }
        return index;
    }

//--------------------------------------------------------------------------------
// PUBLIC METHODS:
// - insert : boolean
// - search : Optional<IndexNode>
// - remove : boolean
// - copy, clear
//--------------------------------------------------------------------------------

    /**
     * Links a new node for {@code record} at the first empty slot on its search path.
     * A record whose CPF is already indexed is ignored: the existing node keeps its
     * payload and position.
     *
     * @return true if a node was created, false for a duplicate key
     */
    public boolean insert(final Record record, final int position) {
        checkNotNull(record, "record");
        checkArgument(position >= 0, "position must be non-negative: %s", position);
        final String key = record.getCpf();

        if (root == null) {
            root = new IndexNode(record.copy(), position);
            size++;
            return true;
        }
        IndexNode p = root;
        while (true) {
            final int c = key.compareTo(p.getKey());
            if (c == 0) {
                LOGGER.debug("Key {} already indexed at position {}, ignoring position {}", key, p.position, position);
                return false;
            }
            final IndexNode next = (c < 0) ? p.left : p.right;
            if (next == null) {
                final IndexNode n = new IndexNode(record.copy(), position);
                if (c < 0) p.left = n;
                else p.right = n;
                size++;
                return true;
            }
            p = next;
        }
    }

    public Optional<IndexNode> search(final String cpf) {
        checkNotNull(cpf, "cpf");
        IndexNode n = root;
        while (n != null) {
            final int c = cpf.compareTo(n.getKey());
            if (c == 0) return Optional.of(n);
            n = (c < 0) ? n.left : n.right;
        }
        return Optional.empty();
    }

    public boolean contains(final String cpf) {
        return search(cpf).isPresent();
    }

    /**
     * Hibbard deletion. A node with two children keeps its place in the tree and takes
     * over the record and position of its in-order successor, whose own node is then
     * unlinked. Removing an absent key leaves the tree untouched.
     *
     * @return true if a key was removed
     */
    public boolean remove(final String cpf) {
        checkNotNull(cpf, "cpf");

        /** SEARCH **/
        IndexNode parent = null;
        IndexNode n = root;
        while (n != null) {
            final int c = cpf.compareTo(n.getKey());
            if (c == 0) break;
            parent = n;
            n = (c < 0) ? n.left : n.right;
        }
        /** END SEARCH **/

        if (n == null) {
            LOGGER.debug("Key {} not indexed, nothing to remove", cpf);
            return false;
        }

        if (n.left == null) {
            replaceChild(parent, n, n.right);
        } else if (n.right == null) {
            replaceChild(parent, n, n.left);
        } else {
            // successor is the leftmost node of the right subtree, it has no left child
            IndexNode succParent = n;
            IndexNode succ = n.right;
            while (succ.left != null) {
                succParent = succ;
                succ = succ.left;
            }
            n.record = succ.record;
            n.position = succ.position;
            replaceChild(succParent, succ, succ.right);
        }
        size--;
        return true;
    }

    /** Deep copy: no node and no record is shared with the returned tree. */
    public RecordIndex copy() {
        final RecordIndex clone = new RecordIndex();
        if (root == null) return clone;

        clone.root = copyOf(root);
        clone.size = size;
        final Deque<IndexNode> from = new ArrayDeque<>();
        final Deque<IndexNode> to = new ArrayDeque<>();
        from.push(root);
        to.push(clone.root);
        while (!from.isEmpty()) {
            final IndexNode src = from.pop();
            final IndexNode dst = to.pop();
            if (src.left != null) {
                dst.left = copyOf(src.left);
                from.push(src.left);
                to.push(dst.left);
            }
            if (src.right != null) {
                dst.right = copyOf(src.right);
                from.push(src.right);
                to.push(dst.right);
            }
        }
        return clone;
    }

    /** Unlinks every node bottom-up and leaves the tree empty. */
    public void clear() {
        for (IndexNode n : nodes(TraversalOrder.POST_ORDER)) {
            n.left = null;
            n.right = null;
        }
        LOGGER.debug("Cleared index of {} nodes", size);
        root = null;
        size = 0;
    }

    public int size() {
        return size;
    }

    public boolean isEmpty() {
        return root == null;
    }

    /** Number of levels; 0 for an empty tree. */
    public int height() {
        if (root == null) return 0;
        int levels = 0;
        final Deque<IndexNode> level = new ArrayDeque<>();
        level.add(root);
        while (!level.isEmpty()) {
            levels++;
            for (int i = level.size(); i > 0; i--) {
                final IndexNode n = level.poll();
                if (n.left != null) level.add(n.left);
                if (n.right != null) level.add(n.right);
            }
        }
        return levels;
    }

    IndexNode root() {
        return root;
    }

//--------------------------------------------------------------------------------
// TRAVERSALS
//--------------------------------------------------------------------------------

    public List<Record> traverse(final TraversalOrder order) {
        final List<IndexNode> visited = nodes(order);
        final List<Record> records = new ArrayList<>(visited.size());
        for (IndexNode n : visited) records.add(n.record);
        return records;
    }

    public List<Record> preOrder() {
        return traverse(TraversalOrder.PRE_ORDER);
    }

    /** Records in ascending CPF order. */
    public List<Record> inOrder() {
        return traverse(TraversalOrder.IN_ORDER);
    }

    public List<Record> postOrder() {
        return traverse(TraversalOrder.POST_ORDER);
    }

    public List<Record> breadthFirst() {
        return traverse(TraversalOrder.BREADTH_FIRST);
    }

    /** Nodes in the given order, each visited exactly once. */
    public List<IndexNode> nodes(final TraversalOrder order) {
        checkNotNull(order, "order");
        final List<IndexNode> out = new ArrayList<>(size);
        if (root == null) return out;
        switch (order) {
            case PRE_ORDER:
                preOrder(out);
                break;
            case IN_ORDER:
                inOrder(out);
                break;
            case POST_ORDER:
                postOrder(out);
                break;
            case BREADTH_FIRST:
                breadthFirst(out);
                break;
            default:
                throw new AssertionError(order);
        }
        return out;
    }

//--------------------------------------------------------------------------------
// PRIVATE METHODS
//--------------------------------------------------------------------------------

    private void replaceChild(final IndexNode parent, final IndexNode child, final IndexNode replacement) {
        if (parent == null) root = replacement;
        else if (parent.left == child) parent.left = replacement;
        else parent.right = replacement;
    }

    private static IndexNode copyOf(final IndexNode n) {
        return new IndexNode(n.record.copy(), n.position);
    }

    private void preOrder(final List<IndexNode> out) {
        final Deque<IndexNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            final IndexNode n = stack.pop();
            out.add(n);
            // right first so that left is popped first
            if (n.right != null) stack.push(n.right);
            if (n.left != null) stack.push(n.left);
        }
    }

    private void inOrder(final List<IndexNode> out) {
        final Deque<IndexNode> stack = new ArrayDeque<>();
        IndexNode n = root;
        while (n != null || !stack.isEmpty()) {
            while (n != null) {
                stack.push(n);
                n = n.left;
            }
            n = stack.pop();
            out.add(n);
            n = n.right;
        }
    }

    private void postOrder(final List<IndexNode> out) {
        // node-right-left order, reversed
        final Deque<IndexNode> stack = new ArrayDeque<>();
        final Deque<IndexNode> reversed = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            final IndexNode n = stack.pop();
            reversed.push(n);
            if (n.left != null) stack.push(n.left);
            if (n.right != null) stack.push(n.right);
        }
        out.addAll(reversed);
    }

    private void breadthFirst(final List<IndexNode> out) {
        final Deque<IndexNode> queue = new ArrayDeque<>();
        queue.add(root);
        while (!queue.isEmpty()) {
            final IndexNode n = queue.poll();
            out.add(n);
            if (n.left != null) queue.add(n.left);
            if (n.right != null) queue.add(n.right);
        }
    }
}
