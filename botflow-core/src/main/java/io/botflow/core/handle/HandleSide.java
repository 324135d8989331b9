package io.botflow.core.handle;

/// Edge of the node card a handle is drawn on.
public enum HandleSide {
    LEFT("left"),
    RIGHT("right");

    private final String wireName;

    HandleSide(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
