package io.botflow.core.handle;

/// Description of one port of a node, as consumed by renderers.
///
/// @param id handle id in wire grammar, e.g. `out:menu:menu-1`
/// @param label human-readable caption
/// @param side card edge the port sits on
/// @param input true for the `in` handle, false for outputs
/// @param order zero-based position among the node's outputs
/// @param variant display variant
public record HandleSpec(
        String id, String label, HandleSide side, boolean input, int order, HandleVariant variant) {

    public static HandleSpec output(String id, String label, int order, HandleVariant variant) {
        return new HandleSpec(id, label, HandleSide.RIGHT, false, order, variant);
    }

    /// The single input port every node has.
    public static HandleSpec inputHandle() {
        return new HandleSpec(
                HandleId.INPUT, "Input", HandleSide.LEFT, true, 0, HandleVariant.DEFAULT);
    }
}
