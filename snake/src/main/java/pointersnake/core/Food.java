package pointersnake.core;

import java.util.ArrayList;
import java.util.List;

public record Food(Pos topLeft, int size) {

    public boolean contains(Pos p) {
        return p.x() >= topLeft.x() && p.x() < topLeft.x() + size
                && p.y() >= topLeft.y() && p.y() < topLeft.y() + size;
    }

    public List<Pos> cells() {
        List<Pos> out = new ArrayList<>(size * size);
        for (int dx = 0; dx < size; dx++) {
            for (int dy = 0; dy < size; dy++) out.add(new Pos(topLeft.x() + dx, topLeft.y() + dy));
        }
        return out;
    }
}
