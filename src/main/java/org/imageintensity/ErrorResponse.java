package org.imageintensity;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(name = "ErrorResponse")
public class ErrorResponse {

    @Schema(description = "Error description")
    public final String error;

    public ErrorResponse(String error) {
        this.error = error;
    }
}
