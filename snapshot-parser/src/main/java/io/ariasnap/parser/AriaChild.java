package io.ariasnap.parser;

/**
 * An entry in a snapshot tree: either an element node or a literal text leaf.
 *
 * <p>Children of an {@link AriaNode} keep source order, so a mixed list of nodes and text leaves
 * reads exactly like the snapshot it came from.
 */
public sealed interface AriaChild permits AriaNode, AriaText {}
