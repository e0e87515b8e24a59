package pointersnake.core;

public enum Dir {
    UP_LEFT(-1, -1), UP(0, -1), UP_RIGHT(1, -1),
    LEFT(-1, 0), RIGHT(1, 0),
    DOWN_LEFT(-1, 1), DOWN(0, 1), DOWN_RIGHT(1, 1);

    public final int dx, dy;
    Dir(int dx, int dy) { this.dx = dx; this.dy = dy; }

    public boolean opposite(Dir o) { return dx + o.dx == 0 && dy + o.dy == 0; }

    public static Dir of(int dx, int dy) {
        for (Dir d : values()) {
            if (d.dx == dx && d.dy == dy) return d;
        }
        return null;
    }
}
