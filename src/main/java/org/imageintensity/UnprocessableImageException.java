package org.imageintensity;

/**
 * Żądanie miało poprawny kształt, ale przesłanych bajtów nie da się przetworzyć na wynik.
 */
public class UnprocessableImageException extends Exception {

    public UnprocessableImageException(String message) {
        super(message);
    }

    public UnprocessableImageException(String message, Throwable cause) {
        super(message, cause);
    }
}
