package pointersnake.core;

// x is the column, y the row
public record Pos(int x, int y) {
    public Pos plus(Dir d) { return new Pos(x + d.dx, y + d.dy); }
}
