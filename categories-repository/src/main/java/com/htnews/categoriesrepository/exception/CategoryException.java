package com.htnews.categoriesrepository.exception;

/**
 * Base type of every failure raised by the categories repository.
 * Catch this for generic handling, or {@link CategoryNotFoundFailure} for a missing category.
 * The failure that triggered it (with its stack trace) is available from {@link #getCause()}.
 */
public abstract class CategoryException extends RuntimeException {

    CategoryException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Message of the cause, or its {@code toString()} when it carries no message.
     */
    public static String describe(Throwable cause) {
        if (cause == null) {
            return "unknown cause";
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.toString();
    }
}
