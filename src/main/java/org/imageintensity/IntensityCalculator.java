package org.imageintensity;

import org.springframework.stereotype.Component;

/**
 * Średnia intensywność obrazu: dla każdego piksela (R+G+B)/3 w arytmetyce całkowitej,
 * potem suma dzielona przez liczbę pikseli.
 */
@Component
public class IntensityCalculator {

    /**
     * Zaokrąglenie w dół następuje dla każdego piksela osobno, przed sumowaniem.
     * Zmiana kolejności (dzielenie zmiennoprzecinkowe na piksel albo sumowanie kanałów
     * przed dzieleniem) daje inne wyniki.
     *
     * @throws EmptyImageException gdy siatka nie ma ani jednego piksela
     */
    public double averageIntensity(PixelGrid grid) throws EmptyImageException {
        long pixelCount = grid.pixelCount();
        if (pixelCount == 0) {
            throw new EmptyImageException("Brak pikseli w obrazie (" + grid.width() + "x" + grid.height() + ")");
        }

        long totalIntensity = 0L;
        int size = grid.size();
        for (int i = 0; i < size; i++) {
            int pixel = grid.rgbAt(i);
            int r = (pixel >> 16) & 0xff;
            int g = (pixel >> 8) & 0xff;
            int b = pixel & 0xff;
            totalIntensity += (r + g + b) / 3;
        }

        return (double) totalIntensity / (double) pixelCount;
    }
}
