package pointersnake.ui;

import com.googlecode.lanterna.TerminalPosition;
import com.googlecode.lanterna.TerminalSize;
import com.googlecode.lanterna.TextColor;
import com.googlecode.lanterna.gui2.AbstractComponent;
import com.googlecode.lanterna.gui2.ComponentRenderer;
import com.googlecode.lanterna.gui2.TextGUIGraphics;
import pointersnake.core.Board;
import pointersnake.core.Pos;
import pointersnake.core.RenderState;

import java.util.List;
import java.util.function.Supplier;

public final class BoardView extends AbstractComponent<BoardView> {
    public static final int COLS_PER_CELL = 2;

    private static final TextColor BG = new TextColor.RGB(12, 12, 12);
    private static final TextColor BORDER = new TextColor.RGB(110, 110, 110);
    private static final TextColor HEAD = new TextColor.RGB(40, 220, 90);
    private static final TextColor BODY = new TextColor.RGB(60, 200, 80);
    private static final TextColor TAIL = new TextColor.RGB(30, 120, 40);
    private static final TextColor FOOD = new TextColor.RGB(220, 70, 40);
    private static final TextColor FLASH = new TextColor.RGB(255, 40, 40);
    private static final TextColor TEXT = new TextColor.RGB(255, 255, 255);

    private final Supplier<RenderState> state;
    private volatile TerminalPosition fieldOrigin;

    public BoardView(Supplier<RenderState> state) { this.state = state; }

    public TerminalPosition fieldOriginOnScreen() {
        TerminalPosition local = fieldOrigin;
        if (local == null || getBasePane() == null) return null;
        return toGlobal(local);
    }

    @Override protected ComponentRenderer<BoardView> createDefaultRenderer() {
        return new ComponentRenderer<>() {
            @Override public TerminalSize getPreferredSize(BoardView c) {
                RenderState s = state.get();
                if (s == null) return new TerminalSize(10, 10);
                return new TerminalSize(fieldW(s.board()), fieldH(s.board()));
            }

            @Override public void drawComponent(TextGUIGraphics g, BoardView c) {
                RenderState s = state.get();
                g.setBackgroundColor(BG);
                g.setForegroundColor(BG);
                g.fill(' ');

                if (s == null) return;

                Board b = s.board();
                int fw = fieldW(b), fh = fieldH(b);
                int aw = g.getSize().getColumns(), ah = g.getSize().getRows();
                int ox = Math.max(0, (aw - fw) / 2);
                int oy = Math.max(0, (ah - fh) / 2);
                fieldOrigin = new TerminalPosition(ox + 1, oy + 1);

                g.setForegroundColor(BORDER);
                g.setBackgroundColor(BG);
                box(g, ox, oy, fw, fh);

                for (Pos p : s.food().cells()) cell(g, ox, oy, p.x(), p.y(), FOOD);

                List<Pos> body = s.body();
                for (int i = body.size() - 1; i >= 0; i--) {
                    Pos p = body.get(i);
                    TextColor color = i == 0 ? (s.eating() ? FLASH : HEAD) : (i == body.size() - 1 ? TAIL : BODY);
                    cell(g, ox, oy, p.x(), p.y(), color);
                }

                if (s.over()) banner(g, ox, oy, fw, fh, "GAME OVER - score " + s.score() + " - R to restart");
                else if (s.paused()) banner(g, ox, oy, fw, fh, "Hand lost - PAUSED");
            }
        };
    }

    private static int fieldW(Board b) { return b.w() * COLS_PER_CELL + 2; }
    private static int fieldH(Board b) { return b.h() + 2; }

    private static void box(TextGUIGraphics g, int x, int y, int w, int h) {
        int x2 = x + w - 1, y2 = y + h - 1;
        g.drawLine(x, y, x2, y, '─');
        g.drawLine(x, y2, x2, y2, '─');
        g.drawLine(x, y, x, y2, '│');
        g.drawLine(x2, y, x2, y2, '│');
        g.setCharacter(x, y, '┌');
        g.setCharacter(x2, y, '┐');
        g.setCharacter(x, y2, '└');
        g.setCharacter(x2, y2, '┘');
    }

    private static void cell(TextGUIGraphics g, int ox, int oy, int x, int y, TextColor color) {
        int sx = ox + 1 + x * COLS_PER_CELL;
        int sy = oy + 1 + y;
        if (sx < 0 || sy < 0 || sx + 1 >= g.getSize().getColumns() || sy >= g.getSize().getRows()) return;
        g.setBackgroundColor(color);
        g.setForegroundColor(color);
        g.putString(sx, sy, "  ");
    }

    private static void banner(TextGUIGraphics g, int ox, int oy, int fw, int fh, String text) {
        int x = ox + Math.max(1, (fw - text.length()) / 2);
        int y = oy + fh / 2;
        g.setBackgroundColor(BG);
        g.setForegroundColor(TEXT);
        g.putString(x, y, text);
    }
}
