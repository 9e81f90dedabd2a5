package br.acquasys.infrastructure.telegram;

/**
 * Exception thrown when a Bot API call fails at the HTTP or API level.
 */
public class TelegramApiException extends RuntimeException {

    /** HTTP status, or 0 when the request never got a response. */
    private final int statusCode;
    private final String method;

    public TelegramApiException(String method, int statusCode, String message) {
        super(String.format("[%s:%d] %s", method, statusCode, message));
        this.method = method;
        this.statusCode = statusCode;
    }

    public TelegramApiException(String method, String message, Throwable cause) {
        super(String.format("[%s] %s", method, message), cause);
        this.method = method;
        this.statusCode = 0;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getMethod() {
        return method;
    }

    /** Another process is already long-polling the same bot token. */
    public boolean isConflict() {
        return statusCode == 409;
    }
}
