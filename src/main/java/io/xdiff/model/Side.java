package io.xdiff.model;

/**
 * The two tables being compared. LEFT is the reference ("dataset1"), RIGHT the copy ("dataset2").
 */
public enum Side {
    LEFT("left"),
    RIGHT("right");

    private final String name;

    Side(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public Side other() {
        return this == LEFT ? RIGHT : LEFT;
    }
}
