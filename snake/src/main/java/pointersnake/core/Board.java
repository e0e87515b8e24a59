package pointersnake.core;

// grid centered inside the area left after the margins; origin is the pixel position of cell (0, 0)
public record Board(int w, int h, int cell, int originX, int originY) {
    public static final int MIN_CELLS = 8;

    public static Board build(int pixelW, int pixelH, Margins m, int cellSize) {
        int cell = Math.max(1, cellSize);
        int usableW = Math.max(1, pixelW - m.left() - m.right());
        int usableH = Math.max(1, pixelH - m.top() - m.bottom());

        int w = Math.max(MIN_CELLS, usableW / cell);
        int h = Math.max(MIN_CELLS, usableH / cell);

        int ox = m.left() + Math.max(0, (usableW - w * cell) / 2);
        int oy = m.top() + Math.max(0, (usableH - h * cell) / 2);
        return new Board(w, h, cell, ox, oy);
    }

    public boolean contains(Pos p) { return p.x() >= 0 && p.y() >= 0 && p.x() < w && p.y() < h; }

    public Pos center() { return new Pos(w / 2, h / 2); }

    public Pixel cellCenter(Pos p) {
        return new Pixel(originX + p.x() * cell + cell * 0.5, originY + p.y() * cell + cell * 0.5);
    }

    public Pixel toPixel(double gx, double gy) {
        return new Pixel(originX + gx * cell, originY + gy * cell);
    }

    public Pos toCell(Pixel px) {
        return new Pos((int) Math.floor((px.x() - originX) / cell), (int) Math.floor((px.y() - originY) / cell));
    }
}
