package com.nextrows;

/**
 * Unchecked exception for failures detected locally, before or after the
 * network exchange.
 *
 * <p>
 * Subtypes identify the failing layer:
 * <ul>
 * <li>{@link ValidationException}: request rejected before dispatch</li>
 * <li>{@link SchemaConversionException}: schema could not be normalized</li>
 * <li>{@link ResponseParsingException}: a successful response body did not
 * match the declared shape</li>
 * </ul>
 *
 * <p>
 * Failures reported by the remote service or the network are checked and
 * live in the client module ({@code NextrowsApiException}).
 */
public class NextrowsException extends RuntimeException {

    public NextrowsException(String message) {
        super(message);
    }

    public NextrowsException(String message, Throwable cause) {
        super(message, cause);
    }

    /** Request failed local checks; nothing was sent. */
    public static class ValidationException extends NextrowsException {
        public ValidationException(String message) {
            super(message);
        }

        public ValidationException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * Schema representation is unsupported, or the converter for it is
     * unavailable or failed.
     */
    public static class SchemaConversionException extends ValidationException {
        public SchemaConversionException(String message) {
            super(message);
        }

        public SchemaConversionException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /** A 2xx response body could not be bound to the expected response type. */
    public static class ResponseParsingException extends NextrowsException {
        public ResponseParsingException(String message) {
            super(message);
        }

        public ResponseParsingException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
