package pointersnake.core;

public record Pixel(double x, double y) {}
