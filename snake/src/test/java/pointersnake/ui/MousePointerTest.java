package pointersnake.ui;

import com.googlecode.lanterna.TerminalPosition;
import com.googlecode.lanterna.input.MouseAction;
import com.googlecode.lanterna.input.MouseActionType;
import org.junit.jupiter.api.Test;
import pointersnake.core.Board;
import pointersnake.core.Margins;
import pointersnake.core.Pixel;
import pointersnake.core.Pos;

import static org.assertj.core.api.Assertions.assertThat;

class MousePointerTest {
    private final Board board = Board.build(200, 150, Margins.none(), 10);
    private final TerminalPosition origin = new TerminalPosition(5, 3);

    private static MouseAction moveTo(int col, int row) {
        return new MouseAction(MouseActionType.MOVE, 0, new TerminalPosition(col, row));
    }

    @Test
    void nothingBeforeFirstMove() {
        assertThat(new MousePointer(board).current()).isNull();
    }

    @Test
    void terminalCellMapsIntoBoardPixels() {
        MousePointer p = new MousePointer(board);

        // cell (10, 7) is drawn at columns 25..26, row 10
        p.track(moveTo(25, 10), origin);
        Pixel left = p.current();
        p.track(moveTo(26, 10), origin);
        Pixel right = p.current();

        assertThat(board.toCell(left)).isEqualTo(new Pos(10, 7));
        assertThat(board.toCell(right)).isEqualTo(new Pos(10, 7));
        assertThat(left.y()).isEqualTo(75.0);
    }

    @Test
    void hiddenHandReportsNoDetection() {
        MousePointer p = new MousePointer(board);
        p.track(moveTo(25, 10), origin);

        p.toggleHand();
        assertThat(p.handVisible()).isFalse();
        assertThat(p.current()).isNull();

        p.toggleHand();
        assertThat(p.current()).isNotNull();
    }

    @Test
    void eventsBeforeLayoutAreDropped() {
        MousePointer p = new MousePointer(board);
        p.track(moveTo(25, 10), null);

        assertThat(p.current()).isNull();
    }
}
