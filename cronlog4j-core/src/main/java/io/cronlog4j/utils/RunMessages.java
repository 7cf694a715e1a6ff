package io.cronlog4j.utils;

import io.cronlog4j.core.JobRunRecord;

import java.io.PrintWriter;
import java.io.StringWriter;

/**
 * Builds the message stored in a {@link JobRunRecord}.
 * <p>
 * Every result is bounded by {@link JobRunRecord#MAX_MESSAGE_LENGTH}:
 * <ul>
 *   <li>success: the returned text, cut after the limit</li>
 *   <li>failure: the failure detail, keeping its tail</li>
 *   <li>failure with a partial message: "partial\n...\n" followed by as much of the trace tail as fits</li>
 * </ul>
 */
public final class RunMessages {

    public static final String SEPARATOR = "\n...\n";

    private RunMessages() {
    }

    public static String success(String message) {
        if (message == null) {
            return "";
        }
        return head(message, JobRunRecord.MAX_MESSAGE_LENGTH);
    }

    public static String failure(String partialMessage, String detail) {
        String d = detail == null ? "" : detail;
        if (partialMessage == null || partialMessage.isEmpty()) {
            return tail(d, JobRunRecord.MAX_MESSAGE_LENGTH);
        }

        int room = JobRunRecord.MAX_MESSAGE_LENGTH - partialMessage.length() - SEPARATOR.length();
        if (room <= 0) {
            // the partial message alone does not fit; the failure detail wins
            return tail(d, JobRunRecord.MAX_MESSAGE_LENGTH);
        }
        return partialMessage + SEPARATOR + tail(d, room);
    }

    /**
     * Failure detail of a run: the stack trace followed by the error summary on the last line, so a
     * detail cut down to its tail still names the error.
     */
    public static String failureDetail(Throwable error) {
        return stackTrace(error) + error;
    }

    /**
     * Full stack trace of {@code error}, including causes.
     */
    public static String stackTrace(Throwable error) {
        StringWriter out = new StringWriter();
        try (PrintWriter writer = new PrintWriter(out)) {
            error.printStackTrace(writer);
        }
        return out.toString();
    }

    private static String head(String s, int max) {
        return s.length() <= max ? s : s.substring(0, max);
    }

    private static String tail(String s, int max) {
        return s.length() <= max ? s : s.substring(s.length() - max);
    }
}
