package cafe.woden.multisplit.model;

/**
 * Node of a pane tree: either a {@link SplitNode} dividing space among its children or a {@link
 * LeafNode} holding one pane.
 *
 * <p>Nodes are immutable. Every mutation builds a new spine from the changed node up to the root,
 * so a tree is always owned top-down and old roots stay valid as snapshots.
 */
public sealed interface PaneNode permits SplitNode, LeafNode {}
