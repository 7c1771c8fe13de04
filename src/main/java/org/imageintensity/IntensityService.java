package org.imageintensity;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Łączy dekoder z kalkulatorem. Bezstanowy, więc jedna instancja obsługuje równoległe żądania.
 */
@Service
public class IntensityService {

    private static final Logger log = LoggerFactory.getLogger(IntensityService.class);

    private final ImageDecoder imageDecoder;
    private final IntensityCalculator intensityCalculator;

    public IntensityService(ImageDecoder imageDecoder, IntensityCalculator intensityCalculator) {
        this.imageDecoder = imageDecoder;
        this.intensityCalculator = intensityCalculator;
    }

    /**
     * Bajty -> siatka RGB -> średnia intensywność.
     *
     * @throws ImageDecodeException gdy bajty nie są obrazem
     * @throws EmptyImageException  gdy obraz nie ma pikseli
     */
    public IntensityResult calculate(byte[] imageBytes) throws UnprocessableImageException {
        try {
            PixelGrid grid = imageDecoder.decode(imageBytes);
            double intensity = intensityCalculator.averageIntensity(grid);
            log.debug("Obraz {}x{}: średnia intensywność {}", grid.width(), grid.height(), intensity);
            return new IntensityResult(intensity);
        } catch (UnprocessableImageException e) {
            log.info("Odrzucono obraz ({} B): {}", imageBytes == null ? 0 : imageBytes.length, e.getMessage());
            throw e;
        }
    }
}
