package de.upb.sse.casegen.fixtures;

public class Rectangle extends Shape implements Comparable<Rectangle> {
    private final double width;
    private final double height;

    public Rectangle() {
        this(1, 1);
    }

    public Rectangle(double width, double height) {
        if (width < 0 || height < 0) throw new IllegalArgumentException("Dimensions cannot be negative");
        this.width = width;
        this.height = height;
    }

    public static Rectangle ofSide(double side) {
        return new Rectangle(side, side);
    }

    public static double ratio(double width, double height) {
        return width / height;
    }

    @Override
    public double area() {
        return width * height;
    }

    public double perimeter() {
        return 2 * (width + height);
    }

    public Rectangle scale(double factor) {
        return new Rectangle(width * factor, height * factor);
    }

    public Rectangle scale(double fx, double fy) {
        return new Rectangle(width * fx, height * fy);
    }

    public double getWidth() {
        return width;
    }

    public double getHeight() {
        return height;
    }

    @Override
    public int compareTo(Rectangle other) {
        return Double.compare(area(), other.area());
    }

    @Override
    public String toString() {
        return "Rectangle(" + width + " x " + height + ")";
    }
}
