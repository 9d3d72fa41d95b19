package com.docforensics.models;

import lombok.Value;

import java.util.List;

/**
 * Прямоугольная область на изображении (x, y, ширина, высота) в пикселях
 */
@Value
public class BoundingBox {
    int x;
    int y;
    int width;
    int height;

    public static BoundingBox of(int x, int y, int width, int height) {
        return new BoundingBox(x, y, width, height);
    }

    public int getRight() {
        return x + width;
    }

    public int getBottom() {
        return y + height;
    }

    public int getArea() {
        return width * height;
    }

    /**
     * Высота пересечения по вертикали с другой областью (0 если не пересекаются)
     */
    public int verticalOverlap(BoundingBox other) {
        return Math.max(0, Math.min(getBottom(), other.getBottom()) - Math.max(y, other.getY()));
    }

    public boolean contains(BoundingBox other) {
        return other.getX() >= x && other.getY() >= y
            && other.getRight() <= getRight() && other.getBottom() <= getBottom();
    }

    public List<Integer> toList() {
        return List.of(x, y, width, height);
    }
}
