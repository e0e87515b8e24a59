package pointersnake.core;

public record Margins(int left, int right, int top, int bottom) {
    public static final int SIDE = 70;
    // room under the board so the tracked hand stays in frame
    public static final int HAND_SPACE = 150;

    public static Margins defaults() { return new Margins(SIDE, SIDE, SIDE, SIDE + HAND_SPACE); }

    public static Margins none() { return new Margins(0, 0, 0, 0); }
}
