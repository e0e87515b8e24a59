package pointersnake.app;

import com.googlecode.lanterna.TextColor;
import com.googlecode.lanterna.graphics.SimpleTheme;
import com.googlecode.lanterna.gui2.*;
import com.googlecode.lanterna.input.KeyStroke;
import com.googlecode.lanterna.input.MouseAction;
import com.googlecode.lanterna.screen.Screen;
import com.googlecode.lanterna.screen.TerminalScreen;
import com.googlecode.lanterna.terminal.DefaultTerminalFactory;
import com.googlecode.lanterna.terminal.MouseCaptureMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pointersnake.config.ConfigException;
import pointersnake.config.ConfigLoader;
import pointersnake.config.EngineConfig;
import pointersnake.core.GameEngine;
import pointersnake.core.RenderState;
import pointersnake.ui.BoardView;
import pointersnake.ui.KeyCommands;
import pointersnake.ui.MousePointer;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

public final class Main {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    private static final long POLL_MS = 30; // ~33 Hz

    public static void main(String[] args) throws Exception {
        EngineConfig cfg;
        try {
            ConfigLoader loader = ConfigLoader.createDefault();
            cfg = args.length > 0 ? loader.load(Path.of(args[0])) : loader.loadDefault();
        } catch (ConfigException e) {
            log.error("Bad configuration", e);
            System.err.println(e.getMessage());
            System.exit(2);
            return;
        }

        GameEngine engine = new GameEngine(cfg);

        Screen screen = new TerminalScreen(new DefaultTerminalFactory()
                .setMouseCaptureMode(MouseCaptureMode.CLICK_RELEASE_DRAG_MOVE)
                .createTerminal());
        screen.startScreen();
        screen.setCursorPosition(null);

        try {
            run(screen, engine);
        } catch (IOException e) {
            log.error("Terminal failure", e);
        } finally {
            screen.stopScreen();
        }
    }

    private static void run(Screen screen, GameEngine engine) throws IOException {
        MultiWindowTextGUI gui = new MultiWindowTextGUI(screen, new DefaultWindowManager(), new EmptySpace());
        gui.setTheme(new SimpleTheme(TextColor.ANSI.WHITE, TextColor.ANSI.BLACK));

        BasicWindow w = new BasicWindow("Pointer Snake");
        w.setHints(List.of(Window.Hint.FULL_SCREEN));

        Panel root = new Panel(new BorderLayout());
        Label help = new Label("Move the mouse to steer   H: hide/show hand   R: restart   Q/Esc: quit");
        Label status = new Label("");

        Panel top = new Panel(new LinearLayout(Direction.VERTICAL));
        top.addComponent(help);
        top.addComponent(status);

        RenderState[] frame = new RenderState[1];
        BoardView view = new BoardView(() -> frame[0]);

        root.addComponent(top.withBorder(Borders.singleLine()), BorderLayout.Location.TOP);
        root.addComponent(view.withBorder(Borders.singleLine("Board")), BorderLayout.Location.CENTER);
        w.setComponent(root);
        gui.addWindow(w);

        MousePointer pointer = new MousePointer(engine.board);
        KeyCommands keys = new KeyCommands();

        while (true) {
            for (KeyStroke k; (k = screen.pollInput()) != null; ) {
                if (k instanceof MouseAction m) {
                    pointer.track(m, view.fieldOriginOnScreen());
                    continue;
                }
                switch (keys.map(k)) {
                    case QUIT -> { return; }
                    case RESTART -> engine.reset();
                    case HAND_TOGGLE -> pointer.toggleHand();
                    default -> {}
                }
            }

            long now = System.nanoTime() / 1_000_000;
            RenderState r = engine.update(now, pointer.current());
            frame[0] = r;

            status.setText("Score: " + r.score()
                    + "   Heading: " + r.dir()
                    + (pointer.handVisible() ? "" : "   [hand hidden]")
                    + (r.over() ? "   GAME OVER" : r.paused() ? "   PAUSED" : ""));

            view.invalidate();
            gui.updateScreen();

            try {
                Thread.sleep(POLL_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
        }
    }
}
