package org.imageintensity;

public class EmptyImageException extends UnprocessableImageException {

    public EmptyImageException(String message) {
        super(message);
    }
}
