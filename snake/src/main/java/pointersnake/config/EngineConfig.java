package pointersnake.config;

import pointersnake.core.Margins;

/**
 * Construction parameters of the engine. Times are in milliseconds, the deadzone is a
 * fraction of the cell size.
 */
public record EngineConfig(
        int pixelWidth,
        int pixelHeight,
        Margins margins,
        int cellSize,
        int foodCells,
        long tickMs,
        double deadzoneFraction,
        long pauseAfterMs,
        int maxCatchUp,
        int growPerFood,
        long eatFlashMs
) {
    public static EngineConfig defaults() {
        return new EngineConfig(1280, 720, Margins.defaults(), 26, 3, 120, 0.55, 600, 3, 2, 350);
    }

    public double deadzonePx() { return cellSize * deadzoneFraction; }

    public EngineConfig withPlayfield(int w, int h, Margins m, int cell) {
        return new EngineConfig(w, h, m, cell, foodCells, tickMs, deadzoneFraction,
                pauseAfterMs, maxCatchUp, growPerFood, eatFlashMs);
    }

    public EngineConfig validate() {
        require(pixelWidth > 0, "pixelWidth must be positive, got " + pixelWidth);
        require(pixelHeight > 0, "pixelHeight must be positive, got " + pixelHeight);
        require(margins != null, "margins are missing");
        require(margins.left() >= 0 && margins.right() >= 0 && margins.top() >= 0 && margins.bottom() >= 0,
                "margins must not be negative, got " + margins);
        require(cellSize > 0, "cellSize must be positive, got " + cellSize);
        require(foodCells > 0, "foodCells must be positive, got " + foodCells);
        require(tickMs > 0, "tickMs must be positive, got " + tickMs);
        require(deadzoneFraction > 0 && Double.isFinite(deadzoneFraction),
                "deadzoneFraction must be a positive number, got " + deadzoneFraction);
        require(pauseAfterMs >= 0, "pauseAfterMs must not be negative, got " + pauseAfterMs);
        require(maxCatchUp >= 1, "maxCatchUp must be at least 1, got " + maxCatchUp);
        require(growPerFood >= 0, "growPerFood must not be negative, got " + growPerFood);
        require(eatFlashMs >= 0, "eatFlashMs must not be negative, got " + eatFlashMs);
        return this;
    }

    private static void require(boolean ok, String message) {
        if (!ok) throw new ConfigException("Invalid engine config: " + message);
    }
}
