package com.anonymizer.common.infra;

/**
 * Error formatting utilities: safely extract messages from exceptions.
 */
public final class ErrorUtils {

    private ErrorUtils() {
    }

    /**
     * Format an exception message safely.
     *
     * @return a non-null human-readable error string
     */
    public static String formatErrorMessage(Throwable err) {
        if (err == null)
            return "Error";
        String msg = err.getMessage();
        if (msg != null && !msg.isBlank()) {
            return msg;
        }
        return err.getClass().getSimpleName();
    }

    /**
     * Message of the innermost cause, for OS-level errors wrapped by the JDK.
     */
    public static String rootCauseMessage(Throwable err) {
        if (err == null)
            return "Error";
        Throwable current = err;
        while (current.getCause() != null && current.getCause() != current) {
            current = current.getCause();
        }
        return formatErrorMessage(current);
    }
}
