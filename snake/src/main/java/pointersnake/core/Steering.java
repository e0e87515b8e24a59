package pointersnake.core;

/**
 * Quantizes a continuous pointer position into one of the eight grid directions.
 * A {@code null} result means "leave the pending direction alone".
 */
public final class Steering {
    private Steering() {}

    public static Dir resolve(Pixel head, Pixel pointer, Dir current, double deadzone) {
        double dx = pointer.x() - head.x();
        double dy = pointer.y() - head.y();

        int sx = axis(dx, deadzone);
        int sy = axis(dy, deadzone);
        if (sx == 0 && sy == 0) return null; // jitter around the head

        Dir cand = Dir.of(sx, sy);
        if (current != null && cand.opposite(current)) return null;
        return cand;
    }

    private static int axis(double d, double deadzone) {
        if (d == 0 || Math.abs(d) < deadzone) return 0;
        return d > 0 ? 1 : -1;
    }
}
