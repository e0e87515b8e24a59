package pointersnake.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.Set;

public final class FoodPlacer {
    private static final Logger log = LoggerFactory.getLogger(FoodPlacer.class);

    private final Random rnd;

    public FoodPlacer(Random rnd) { this.rnd = rnd; }

    /**
     * Picks a block uniformly among all positions that fit on the board and do not touch
     * {@code occupied}. When nothing fits the block goes to the board center, overlap accepted.
     */
    public Food place(Board board, Set<Pos> occupied, int k) {
        if (board.w() < k || board.h() < k) {
            log.warn("Food block {}x{} does not fit a {}x{} board, using center", k, k, board.w(), board.h());
            return new Food(board.center(), k);
        }

        List<Pos> candidates = new ArrayList<>();
        for (int x = 0; x <= board.w() - k; x++) {
            for (int y = 0; y <= board.h() - k; y++) {
                if (blockFree(occupied, x, y, k)) candidates.add(new Pos(x, y));
            }
        }

        if (candidates.isEmpty()) {
            Pos fallback = new Pos(Math.max(0, (board.w() - k) / 2), Math.max(0, (board.h() - k) / 2));
            log.warn("No free {}x{} block left for food, falling back to {}", k, k, fallback);
            return new Food(fallback, k);
        }

        return new Food(candidates.get(rnd.nextInt(candidates.size())), k);
    }

    private static boolean blockFree(Set<Pos> occupied, int x0, int y0, int k) {
        for (int dx = 0; dx < k; dx++) {
            for (int dy = 0; dy < k; dy++) {
                if (occupied.contains(new Pos(x0 + dx, y0 + dy))) return false;
            }
        }
        return true;
    }
}
