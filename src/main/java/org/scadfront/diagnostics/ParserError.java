package org.scadfront.diagnostics;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonObject;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.Objects;

/**
 * Base of all diagnostics raised while parsing. Unchecked so that {@link ErrorHandler#report(ParserError)}
 * can re-throw critical errors without forcing checked signatures on callers.
 */
public class ParserError extends RuntimeException {

    private static final Gson GSON = new GsonBuilder().disableHtmlEscaping().create();

    private final ErrorCode code;
    private final Severity severity;
    private final ErrorContext context;

    /**
     * Creates an error at severity {@link Severity#ERROR} with an empty context.
     * @param message The human-readable message.
     * @param code    The error code.
     */
    public ParserError(String message, ErrorCode code) {
        this(message, code, Severity.ERROR, new ErrorContext());
    }

    /**
     * @param message  The human-readable message.
     * @param code     The error code.
     * @param severity The severity.
     * @param context  Additional details; null means an empty context.
     */
    public ParserError(String message, ErrorCode code, Severity severity, ErrorContext context) {
        super(message);
        this.code = Objects.requireNonNull(code, "code");
        this.severity = Objects.requireNonNull(severity, "severity");
        this.context = context != null ? context : new ErrorContext();
    }

    public ErrorCode getCode() {
        return code;
    }

    public Severity getSeverity() {
        return severity;
    }

    /**
     * @return The mutable context, never null.
     */
    public ErrorContext getContext() {
        return context;
    }

    /**
     * Formats the error as {@code SEVERITY [line:column] [code]: message}. The location bracket is
     * left out when line or column is unknown.
     * @return The formatted message.
     */
    public String getFormattedMessage() {
        StringBuilder sb = new StringBuilder(severity.name()).append(' ');
        if (context.hasPosition()) {
            sb.append('[').append(context.getLine()).append(':').append(context.getColumn()).append("] ");
        }
        sb.append('[').append(code.code()).append("]: ").append(getMessage());
        return sb.toString();
    }

    /**
     * @return True if the error is below {@link Severity#ERROR} and never blocks processing.
     */
    public boolean isRecoverable() {
        return !severity.isAtLeast(Severity.ERROR);
    }

    /**
     * @return True if processing of the current session should stop.
     */
    public boolean isFatal() {
        return severity == Severity.FATAL;
    }

    /**
     * Projects the error onto a stable JSON shape for reporting across process boundaries.
     * @return An object with {@code name, message, code, severity, context, stack}.
     */
    public JsonObject toJson() {
        JsonObject json = new JsonObject();
        json.addProperty("name", getClass().getSimpleName());
        json.addProperty("message", getMessage());
        json.addProperty("code", code.code());
        json.addProperty("severity", severity.name());
        json.add("context", GSON.toJsonTree(context));
        json.addProperty("stack", stackTrace());
        return json;
    }

    /**
     * @return {@link #toJson()} rendered as a compact string.
     */
    public String toJsonString() {
        return GSON.toJson(toJson());
    }

    private String stackTrace() {
        StringWriter writer = new StringWriter();
        printStackTrace(new PrintWriter(writer));
        return writer.toString();
    }

    @Override
    public String toString() {
        return getFormattedMessage();
    }
}
