package pointersnake.core;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

public final class GameState {
    public static final int START_LENGTH = 3;

    public final Board board;
    private final Deque<Pos> body = new ArrayDeque<>();
    private final Set<Pos> occupied = new HashSet<>();

    private Dir dir;
    private Dir pendingDir;

    public Food food;
    public int growCredits = 0;
    public int score = 0;
    public boolean over = false;
    public boolean paused = false;
    public long stateOrder = 0;
    public long eatFlashUntil = 0;

    // cells head first
    public GameState(Board board, List<Pos> cells, Dir dir, Food food) {
        this.board = board;
        for (Pos p : cells) {
            if (!occupied.add(p)) throw new IllegalArgumentException("Snake overlaps itself at " + p);
            body.addLast(p);
        }
        if (body.isEmpty()) throw new IllegalArgumentException("Snake needs a head");
        this.dir = dir;
        this.pendingDir = dir;
        this.food = food;
    }

    public static GameState start(Board board) {
        Pos head = board.center();
        List<Pos> cells = new ArrayList<>(START_LENGTH);
        for (int i = 0; i < START_LENGTH; i++) cells.add(new Pos(head.x() - i, head.y()));
        return new GameState(board, cells, Dir.RIGHT, null);
    }

    public Pos head() { return body.peekFirst(); }

    public int length() { return body.size(); }

    public List<Pos> body() { return List.copyOf(body); }

    public Set<Pos> occupied() { return Collections.unmodifiableSet(occupied); }

    public boolean occupies(Pos p) { return occupied.contains(p); }

    public Dir dir() { return dir; }

    public Dir pendingDir() { return pendingDir; }

    public boolean steer(Dir d) {
        if (d == null || d.opposite(dir)) return false;
        pendingDir = d;
        return true;
    }

    // tail removal uses the credits held before this tick's meal
    public StepOutcome step(FoodPlacer placer, int growPerFood) {
        if (over) return StepOutcome.COLLIDED;

        dir = pendingDir;
        Pos next = head().plus(dir);
        if (!board.contains(next) || occupied.contains(next)) {
            over = true;
            return StepOutcome.COLLIDED;
        }

        body.addFirst(next);
        occupied.add(next);

        boolean growing = growCredits > 0;
        if (growing) growCredits--;
        else occupied.remove(body.removeLast());

        StepOutcome out = StepOutcome.MOVED;
        if (food != null && food.contains(next)) {
            score++;
            growCredits += growPerFood;
            food = placer.place(board, occupied, food.size());
            out = StepOutcome.ATE_FOOD;
        }

        stateOrder++;
        return out;
    }
}
