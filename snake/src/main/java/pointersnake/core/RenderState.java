package pointersnake.core;

import java.util.List;

public record RenderState(
        Board board,
        List<Pos> body,
        Food food,
        int score,
        boolean over,
        boolean paused,
        Dir dir,
        boolean eating,
        long stateOrder
) {
    public Pos head() { return body.isEmpty() ? null : body.get(0); }
}
