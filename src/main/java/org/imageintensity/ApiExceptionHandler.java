package org.imageintensity;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MultipartException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

/**
 * Mapowanie błędów na kody HTTP:
 *  - zły kształt żądania (brak pola, nie-multipart, uszkodzony multipart, za duży plik) -> 400
 *  - bajty nie są obrazem albo obraz nie ma pikseli -> 422
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(UnprocessableImageException.class)
    public ResponseEntity<ErrorResponse> unprocessableImage(UnprocessableImageException e) {
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                .body(new ErrorResponse(e.getMessage()));
    }

    @ExceptionHandler(MissingServletRequestPartException.class)
    public ResponseEntity<ErrorResponse> missingPart(MissingServletRequestPartException e) {
        return badRequest("Missing multipart field '" + e.getRequestPartName() + "'", e);
    }

    @ExceptionHandler(MultipartException.class)
    public ResponseEntity<ErrorResponse> malformedMultipart(MultipartException e) {
        return badRequest("Invalid multipart request body", e);
    }

    @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
    public ResponseEntity<ErrorResponse> notMultipart(HttpMediaTypeNotSupportedException e) {
        return badRequest("Expected multipart/form-data request body", e);
    }

    private static ResponseEntity<ErrorResponse> badRequest(String message, Exception cause) {
        log.debug("Odrzucono żądanie: {} ({})", message, cause.getMessage());
        return ResponseEntity.badRequest().body(new ErrorResponse(message));
    }
}
