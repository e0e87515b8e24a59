package pointersnake.ui;

import com.googlecode.lanterna.input.KeyStroke;
import com.googlecode.lanterna.input.KeyType;

// the pointer steers, so the keyboard only drives the session
public final class KeyCommands {
    public enum Action { NONE, QUIT, RESTART, HAND_TOGGLE }

    public Action map(KeyStroke k) {
        if (k == null) return Action.NONE;

        return switch (k.getKeyType()) {
            case EOF, Escape -> Action.QUIT;
            case Character -> switch (Character.toLowerCase(k.getCharacter())) {
                case 'q' -> Action.QUIT;
                case 'r' -> Action.RESTART;
                case 'h' -> Action.HAND_TOGGLE; // hide the "hand" to simulate lost detection
                default -> Action.NONE;
            };
            default -> Action.NONE;
        };
    }
}
