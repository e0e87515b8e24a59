package pointersnake.ui;

import com.googlecode.lanterna.TerminalPosition;
import com.googlecode.lanterna.input.MouseAction;
import pointersnake.core.Board;
import pointersnake.core.Pixel;

/**
 * Stands in for the hand tracker: the terminal mouse is the fingertip. Positions are mapped from
 * terminal cells into the board's pixel space ({@link BoardView} draws one grid cell as two
 * columns and one row). Hiding the hand simulates "no detection".
 */
public final class MousePointer {
    private final Board board;
    private Pixel last;
    private boolean handVisible = true;

    public MousePointer(Board board) { this.board = board; }

    // fieldOrigin: screen position of cell (0, 0), null while detached
    public void track(MouseAction a, TerminalPosition fieldOrigin) {
        if (fieldOrigin == null) return;
        TerminalPosition p = a.getPosition();
        double gx = (p.getColumn() - fieldOrigin.getColumn() + 0.5) / BoardView.COLS_PER_CELL;
        double gy = p.getRow() - fieldOrigin.getRow() + 0.5;
        last = board.toPixel(gx, gy);
    }

    public void toggleHand() { handVisible = !handVisible; }

    public boolean handVisible() { return handVisible; }

    public Pixel current() { return handVisible ? last : null; }
}
