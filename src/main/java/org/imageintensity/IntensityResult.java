package org.imageintensity;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.Locale;

/**
 * Odpowiedź z wynikiem; Jackson serializuje publiczne pola.
 */
@Schema(name = "IntensityResponse")
public class IntensityResult {

    @Schema(description = "The calculated average intensity value (0-255)", minimum = "0", maximum = "255")
    @JsonProperty("average_intensity")
    public final double averageIntensity;

    @Schema(description = "Success message with formatted intensity value",
            example = "Average intensity calculated: 127.50")
    public final String message;

    public IntensityResult(double averageIntensity) {
        this.averageIntensity = averageIntensity;
        // Locale.ROOT, żeby separator dziesiętny był zawsze kropką
        this.message = String.format(Locale.ROOT, "Average intensity calculated: %.2f", averageIntensity);
    }
}
