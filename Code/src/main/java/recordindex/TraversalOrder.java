package recordindex;

/** Visiting orders supported by {@link RecordIndex#traverse(TraversalOrder)}. */
public enum TraversalOrder {
    /** Node, left subtree, right subtree. */
    PRE_ORDER,
    /** Left subtree, node, right subtree: ascending key order. */
    IN_ORDER,
    /** Left subtree, right subtree, node. */
    POST_ORDER,
    /** Level by level, left to right within a level. */
    BREADTH_FIRST
}
