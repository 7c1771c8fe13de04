package org.imageintensity;

public class ImageDecodeException extends UnprocessableImageException {

    public ImageDecodeException(String message) {
        super(message);
    }

    public ImageDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
