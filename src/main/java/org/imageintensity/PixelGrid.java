package org.imageintensity;

import java.util.Arrays;

/**
 * Niezmienna siatka pikseli RGB (8 bitów na kanał), zapisana wierszami.
 * Każdy piksel trzymany jest jako int w postaci 0xRRGGBB.
 */
public final class PixelGrid {

    private final int width;
    private final int height;
    private final int[] pixels;

    private PixelGrid(int width, int height, int[] pixels) {
        this.width = width;
        this.height = height;
        this.pixels = pixels;
    }

    /**
     * Tworzy siatkę z kopii podanej tablicy. Bajt alfa (jeśli jest) zostaje wyzerowany.
     */
    public static PixelGrid of(int width, int height, int[] rgb) {
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException("Ujemny wymiar siatki: " + width + "x" + height);
        }
        if (rgb == null || (long) rgb.length != (long) width * height) {
            throw new IllegalArgumentException("Liczba pikseli nie zgadza się z wymiarami " + width + "x" + height);
        }
        int[] copy = new int[rgb.length];
        for (int i = 0; i < rgb.length; i++) {
            copy[i] = rgb[i] & 0xFFFFFF;
        }
        return new PixelGrid(width, height, copy);
    }

    public static PixelGrid empty(int width, int height) {
        if (width != 0 && height != 0) {
            throw new IllegalArgumentException("Siatka " + width + "x" + height + " nie jest pusta");
        }
        return of(width, height, new int[0]);
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    public long pixelCount() {
        return (long) width * height;
    }

    public boolean isEmpty() {
        return width == 0 || height == 0;
    }

    public int rgb(int x, int y) {
        if (x < 0 || x >= width || y < 0 || y >= height) {
            throw new IndexOutOfBoundsException("Piksel (" + x + "," + y + ") poza siatką " + width + "x" + height);
        }
        return pixels[y * width + x];
    }

    public int red(int x, int y) {
        return (rgb(x, y) >> 16) & 0xff;
    }

    public int green(int x, int y) {
        return (rgb(x, y) >> 8) & 0xff;
    }

    public int blue(int x, int y) {
        return rgb(x, y) & 0xff;
    }

    // Dostęp po indeksie liniowym dla pętli w kalkulatorze
    int size() {
        return pixels.length;
    }

    int rgbAt(int index) {
        return pixels[index];
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PixelGrid)) return false;
        PixelGrid other = (PixelGrid) o;
        return width == other.width && height == other.height && Arrays.equals(pixels, other.pixels);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * width + height) + Arrays.hashCode(pixels);
    }

    @Override
    public String toString() {
        return "PixelGrid[" + width + "x" + height + "]";
    }
}
