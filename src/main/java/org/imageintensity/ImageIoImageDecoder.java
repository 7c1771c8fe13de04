package org.imageintensity;

import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import java.awt.color.ColorSpace;
import java.awt.image.BufferedImage;
import java.awt.image.ColorModel;
import java.awt.image.IndexColorModel;
import java.awt.image.Raster;
import java.io.ByteArrayInputStream;
import java.io.IOException;

/**
 * Dekoder oparty o {@link ImageIO}. Wybór czytnika robi ImageIO na podstawie nagłówka danych:
 * PNG, GIF, TIFF, WBMP z JDK oraz WebP, TGA, PNM, BMP/ICO i JPEG (także CMYK) z wtyczek TwelveMonkeys.
 */
@Component
public class ImageIoImageDecoder implements ImageDecoder {

    static {
        // Wtyczki z zagnieżdżonych jarów Spring Boot są widoczne tylko przez context class loader
        ImageIO.scanForPlugins();
    }

    @Override
    public PixelGrid decode(byte[] imageBytes) throws ImageDecodeException {
        if (imageBytes == null || imageBytes.length == 0) {
            throw new ImageDecodeException("Pusty obraz: brak bajtów do zdekodowania");
        }

        // 1. Bajty -> BufferedImage
        BufferedImage input;
        try (ByteArrayInputStream bais = new ByteArrayInputStream(imageBytes)) {
            input = ImageIO.read(bais);
        } catch (IOException e) {
            throw new ImageDecodeException("Nie udało się wczytać obrazu z bajtów: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            // Niektóre wtyczki ImageIO rzucają wyjątki niekontrolowane na uszkodzonych danych
            throw new ImageDecodeException("Uszkodzone dane obrazu: " + e, e);
        }
        if (input == null) {
            throw new ImageDecodeException("Nierozpoznany format obrazu");
        }

        // 2. BufferedImage -> RGB
        return toRgbGrid(input);
    }

    static PixelGrid toRgbGrid(BufferedImage image) {
        int width = image.getWidth();
        int height = image.getHeight();
        if (width == 0 || height == 0) {
            return PixelGrid.empty(width, height);
        }

        ColorModel cm = image.getColorModel();
        if (isGray(cm)) {
            return grayToRgb(image.getRaster(), cm.getComponentSize(0), width, height);
        }

        // getRGB zwraca ARGB bez premultiplikacji; kanał alfa po prostu odrzucamy
        int[] argb = image.getRGB(0, 0, width, height, null, 0, width);
        return PixelGrid.of(width, height, argb);
    }

    private static boolean isGray(ColorModel cm) {
        return !(cm instanceof IndexColorModel)
                && cm.getColorSpace().getType() == ColorSpace.TYPE_GRAY;
    }

    /**
     * Odcień szarości kopiujemy do trzech kanałów bez korekcji gamma,
     * którą getRGB stosuje dla liniowej przestrzeni CS_GRAY.
     */
    private static PixelGrid grayToRgb(Raster raster, int bits, int width, int height) {
        int max = (1 << bits) - 1;
        int[] row = new int[width];
        int[] rgb = new int[width * height];
        for (int y = 0; y < height; y++) {
            raster.getSamples(raster.getMinX(), raster.getMinY() + y, width, 1, 0, row);
            for (int x = 0; x < width; x++) {
                int v = bits == 8 ? row[x] : (int) Math.round(row[x] * 255.0 / max);
                rgb[y * width + x] = (v << 16) | (v << 8) | v;
            }
        }
        return PixelGrid.of(width, height, rgb);
    }
}
