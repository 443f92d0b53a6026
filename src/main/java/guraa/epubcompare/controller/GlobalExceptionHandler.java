package guraa.epubcompare.controller;

import guraa.epubcompare.core.ArchiveReadException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

import java.io.IOException;
import java.nio.file.InvalidPathException;
import java.util.HashMap;
import java.util.Map;

/**
 * Global exception handler for the application
 */
@ControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    /**
     * Handle archives that cannot be opened
     * @param e The exception
     * @return Response entity with error message
     */
    @ExceptionHandler(ArchiveReadException.class)
    public ResponseEntity<Map<String, String>> handleArchiveReadException(ArchiveReadException e) {
        logger.warn("Unreadable archive: {}", e.getMessage());
        return error(HttpStatus.UNPROCESSABLE_ENTITY, "Cannot read archive " + e.getLocation().getFileName()
                + " as an EPUB file");
    }

    /**
     * Handle invalid requests
     * @param e The exception
     * @return Response entity with error message
     */
    @ExceptionHandler({IllegalArgumentException.class, InvalidPathException.class,
            HttpMessageNotReadableException.class, MissingServletRequestPartException.class})
    public ResponseEntity<Map<String, String>> handleBadRequest(Exception e) {
        logger.warn("Bad request: {}", e.getMessage());
        return error(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    /**
     * Handle IO exceptions
     * @param e The exception
     * @return Response entity with error message
     */
    @ExceptionHandler(IOException.class)
    public ResponseEntity<Map<String, String>> handleIOException(IOException e) {
        logger.error("IO Exception", e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "Error processing file: " + e.getMessage());
    }

    /**
     * Handle all other exceptions
     * @param e The exception
     * @return Response entity with error message
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, String>> handleGenericException(Exception e) {
        logger.error("Unexpected exception", e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred: " + e.getMessage());
    }

    private ResponseEntity<Map<String, String>> error(HttpStatus status, String message) {
        Map<String, String> response = new HashMap<>();
        response.put("error", message);
        return ResponseEntity.status(status).contentType(MediaType.APPLICATION_JSON).body(response);
    }
}
