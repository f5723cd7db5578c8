package com.nextrows.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Checked exception for failed exchanges with the NextRows API.
 *
 * <p>
 * Checked because remote failures are <em>expected</em>: an exhausted credit
 * balance or an unknown app id is part of normal operation. The HTTP status
 * alone decides the subtype:
 * <ul>
 * <li>401: {@link AuthException}</li>
 * <li>402: {@link PaymentRequiredException}</li>
 * <li>404: {@link NotFoundException}</li>
 * <li>any other non-2xx: {@link UnknownApiException}</li>
 * </ul>
 * Non-HTTP failures are {@link RequestTimeoutException} and
 * {@link NetworkException}, both with status code {@code -1}.
 */
public class NextrowsApiException extends Exception {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final int statusCode;
    private final String responseBody;

    /**
     * @param message      human-readable error description
     * @param statusCode   HTTP status code, or -1 for non-HTTP failures
     * @param responseBody raw response body, or null if none was received
     */
    public NextrowsApiException(String message, int statusCode, String responseBody) {
        super(message);
        this.statusCode = statusCode;
        this.responseBody = responseBody;
    }

    /**
     * @param message      human-readable error description
     * @param statusCode   HTTP status code, or -1 for non-HTTP failures
     * @param responseBody raw response body, or null if none was received
     * @param cause        underlying cause
     */
    public NextrowsApiException(String message, int statusCode, String responseBody, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
        this.responseBody = responseBody;
    }

    /**
     * @return the HTTP status code, or -1 for non-HTTP failures
     */
    public int getStatusCode() {
        return statusCode;
    }

    /**
     * @return the raw response body as received, or null
     */
    public String getResponseBody() {
        return responseBody;
    }

    /**
     * @return true if this represents an HTTP error (status code > 0)
     */
    public boolean isHttpError() {
        return statusCode > 0;
    }

    /**
     * Select the exception for a non-2xx response.
     *
     * @param statusCode the HTTP status
     * @param body       the raw response body, used verbatim and for the message
     * @return the matching subtype
     */
    public static NextrowsApiException forStatus(int statusCode, String body) {
        String message = "HTTP " + statusCode + ": " + describe(body);
        return switch (statusCode) {
            case 401 -> new AuthException(message, body);
            case 402 -> new PaymentRequiredException(message, body);
            case 404 -> new NotFoundException(message, body);
            default -> new UnknownApiException(message, statusCode, body);
        };
    }

    /**
     * Use the service's {@code error} or {@code message} field when the body is
     * a JSON envelope; otherwise the raw text.
     */
    private static String describe(String body) {
        if (body == null || body.isBlank()) {
            return "<empty body>";
        }
        if (body.trim().startsWith("{")) {
            try {
                JsonNode node = MAPPER.readTree(body);
                if (node.path("error").isTextual()) {
                    return node.get("error").asText();
                }
                if (node.path("message").isTextual()) {
                    return node.get("message").asText();
                }
            } catch (Exception ignored) {
                // Not valid JSON, fall through to the raw body
            }
        }
        return body;
    }

    /** HTTP 401: missing or invalid API key. */
    public static class AuthException extends NextrowsApiException {
        public AuthException(String message, String responseBody) {
            super(message, 401, responseBody);
        }
    }

    /** HTTP 402: the account has no credits left. */
    public static class PaymentRequiredException extends NextrowsApiException {
        public PaymentRequiredException(String message, String responseBody) {
            super(message, 402, responseBody);
        }
    }

    /** HTTP 404: unknown resource, typically an app id. */
    public static class NotFoundException extends NextrowsApiException {
        public NotFoundException(String message, String responseBody) {
            super(message, 404, responseBody);
        }
    }

    /** Any other non-2xx status. */
    public static class UnknownApiException extends NextrowsApiException {
        public UnknownApiException(String message, int statusCode, String responseBody) {
            super(message, statusCode, responseBody);
        }
    }

    /** The configured timeout elapsed before a response arrived. */
    public static class RequestTimeoutException extends NextrowsApiException {
        public RequestTimeoutException(String message, Throwable cause) {
            super(message, -1, null, cause);
        }
    }

    /** The service could not be reached (DNS, refused connection, TLS). */
    public static class NetworkException extends NextrowsApiException {
        public NetworkException(String message, Throwable cause) {
            super(message, -1, null, cause);
        }
    }
}
