package org.imageintensity;

/**
 * Zamienia surowe bajty obrazu na siatkę pikseli RGB.
 * Format rozpoznawany jest po zawartości, nie po nazwie pliku.
 */
public interface ImageDecoder {

    PixelGrid decode(byte[] imageBytes) throws ImageDecodeException;
}
