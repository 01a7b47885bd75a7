package org.dxworks.rfcmark.builder;

import java.util.List;

/**
 * How one tag of the vocabulary maps onto document nodes, and where it may appear.
 */
public final class TagRule {

    public enum Placement {
        /** Starts a block of its own; only valid where blocks may appear. */
        BLOCK,
        /** Part of running text; inside block containers it joins the surrounding paragraph. */
        INLINE,
        /** Block where blocks may appear, inline inside running text. */
        EITHER,
        /** Recognized, produces no output. */
        SKIP
    }

    private static final NodeFactory NOTHING = element -> List.of();

    private final Placement placement;
    private final NodeFactory blockFactory;
    private final NodeFactory inlineFactory;

    private TagRule(Placement placement, NodeFactory blockFactory, NodeFactory inlineFactory) {
        this.placement = placement;
        this.blockFactory = blockFactory;
        this.inlineFactory = inlineFactory;
    }

    public static TagRule block(NodeFactory factory) {
        return new TagRule(Placement.BLOCK, factory, null);
    }

    public static TagRule inline(NodeFactory factory) {
        return new TagRule(Placement.INLINE, null, factory);
    }

    public static TagRule either(NodeFactory blockFactory, NodeFactory inlineFactory) {
        return new TagRule(Placement.EITHER, blockFactory, inlineFactory);
    }

    public static TagRule skip() {
        return new TagRule(Placement.SKIP, NOTHING, NOTHING);
    }

    public Placement getPlacement() {
        return placement;
    }

    public NodeFactory getBlockFactory() {
        return blockFactory;
    }

    public NodeFactory getInlineFactory() {
        return inlineFactory;
    }
}
