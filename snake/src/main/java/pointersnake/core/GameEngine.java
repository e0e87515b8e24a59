package pointersnake.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pointersnake.config.EngineConfig;

import java.util.Random;

/**
 * Drives one snake on a fixed logical tick. The caller owns the loop and passes its own
 * millisecond timestamps; nothing here reads the clock or starts a thread.
 */
public final class GameEngine {
    private static final Logger log = LoggerFactory.getLogger(GameEngine.class);

    public final EngineConfig cfg;
    public final Board board;
    private final FoodPlacer placer;
    private final double deadzone;

    private GameState state;
    private long lastTickAt;
    private long lastSignalAt;
    private boolean anchored;

    public GameEngine(EngineConfig cfg) { this(cfg, new FoodPlacer(new Random())); }

    public GameEngine(EngineConfig cfg, FoodPlacer placer) {
        this.cfg = cfg.validate();
        this.board = Board.build(cfg.pixelWidth(), cfg.pixelHeight(), cfg.margins(), cfg.cellSize());
        this.placer = placer;
        this.deadzone = cfg.deadzonePx();
        log.info("Board {}x{} cells of {}px, origin ({}, {})",
                board.w(), board.h(), board.cell(), board.originX(), board.originY());
        reset();
    }

    // clocks re-anchor on the next update
    public void reset() {
        state = GameState.start(board);
        state.food = placer.place(board, state.occupied(), cfg.foodCells());
        anchored = false;
        log.info("New game, food at {}", state.food.topLeft());
    }

    public RenderState update(long now, Pixel pointer) {
        if (!anchored) {
            lastTickAt = now;
            lastSignalAt = now;
            anchored = true;
        }
        if (state.over) return snapshot(now);

        if (pointer != null) {
            lastSignalAt = now;
            if (state.paused) {
                state.paused = false;
                log.debug("Pointer back, resuming");
            }
            Dir d = Steering.resolve(board.cellCenter(state.head()), pointer, state.dir(), deadzone);
            if (d != null) state.steer(d);
        } else if (!state.paused && now - lastSignalAt > cfg.pauseAfterMs()) {
            state.paused = true;
            log.debug("No pointer for {} ms, pausing", now - lastSignalAt);
        }

        if (state.paused) return snapshot(now);

        long elapsed = now - lastTickAt;
        int steps = (int) Math.max(0, Math.min(elapsed / cfg.tickMs(), cfg.maxCatchUp()));
        lastTickAt += steps * cfg.tickMs();

        for (int i = 0; i < steps; i++) {
            StepOutcome out = state.step(placer, cfg.growPerFood());
            if (out == StepOutcome.ATE_FOOD) {
                state.eatFlashUntil = now + cfg.eatFlashMs();
                log.debug("Ate food, score {}, next food at {}", state.score, state.food.topLeft());
            } else if (out == StepOutcome.COLLIDED) {
                log.info("Game over at {} heading {}, score {}", state.head(), state.dir(), state.score);
                break;
            }
        }
        return snapshot(now);
    }

    public GameState state() { return state; }

    private RenderState snapshot(long now) {
        return new RenderState(board, state.body(), state.food, state.score, state.over, state.paused,
                state.dir(), now < state.eatFlashUntil, state.stateOrder);
    }
}
