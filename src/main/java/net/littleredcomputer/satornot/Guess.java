package net.littleredcomputer.satornot;

/**
 * A player's claim about a puzzle. Button indices are those of the game's two buttons.
 */
public enum Guess {
    SAT(1),
    NOT_SAT(2);

    private final int buttonIndex;

    Guess(int buttonIndex) {
        this.buttonIndex = buttonIndex;
    }

    public int buttonIndex() {
        return buttonIndex;
    }

    public static Guess fromButtonIndex(int index) {
        for (Guess g : values()) if (g.buttonIndex == index) return g;
        throw new IllegalArgumentException("invalid button index: " + index);
    }
}
