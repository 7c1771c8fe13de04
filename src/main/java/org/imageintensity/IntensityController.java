package org.imageintensity;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.parameters.RequestBody;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.Part;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.multipart.MultipartHttpServletRequest;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

import java.io.IOException;
import java.io.InputStream;

/**
 * Kontroler przyjmujący multipart z polem "image" i zwracający średnią intensywność obrazu.
 */
@RestController
@Tag(name = "Image Processing", description = "Image intensity calculation API")
public class IntensityController {

    static final String IMAGE_FIELD = "image";

    private final IntensityService intensityService;

    public IntensityController(IntensityService intensityService) {
        this.intensityService = intensityService;
    }

    @Operation(summary = "Calculate the average intensity of an uploaded image",
            requestBody = @RequestBody(
                    description = "Image file uploaded as multipart/form-data with field name 'image'",
                    required = true,
                    content = @Content(mediaType = MediaType.MULTIPART_FORM_DATA_VALUE,
                            schema = @Schema(type = "object", requiredProperties = {IMAGE_FIELD}))),
            responses = {
                    @ApiResponse(responseCode = "200", description = "Successfully calculated image intensity",
                            content = @Content(schema = @Schema(implementation = IntensityResult.class))),
                    @ApiResponse(responseCode = "400", description = "Bad request - invalid or missing image data",
                            content = @Content(schema = @Schema(implementation = ErrorResponse.class))),
                    @ApiResponse(responseCode = "422", description = "Unprocessable entity - invalid image format",
                            content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
            })
    @PostMapping(
            value = "/calculate-intensity",
            consumes = MediaType.MULTIPART_FORM_DATA_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE
    )
    public IntensityResult calculateIntensity(MultipartHttpServletRequest request)
            throws IOException, ServletException, UnprocessableImageException {
        byte[] imageBytes = readImageField(request);
        return intensityService.calculate(imageBytes);
    }

    /**
     * Pole "image" może przyjść jako plik albo jako zwykłe pole formularza, bierzemy oba.
     * Puste pole to nadal pole: trafia do dekodera, nie kończy się błędem 400.
     */
    private byte[] readImageField(MultipartHttpServletRequest request)
            throws IOException, ServletException, MissingServletRequestPartException {
        MultipartFile file = request.getFile(IMAGE_FIELD);
        if (file != null) {
            return file.getBytes();
        }
        Part part = request.getPart(IMAGE_FIELD);
        if (part != null) {
            try (InputStream in = part.getInputStream()) {
                return in.readAllBytes();
            }
        }
        throw new MissingServletRequestPartException(IMAGE_FIELD);
    }
}
