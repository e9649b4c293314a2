package io.fixorder.order;

public class OrderValidationException extends IllegalArgumentException {
    private static final long serialVersionUID = 1L;

    public OrderValidationException(String message) {
        super(message);
    }

    public OrderValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
