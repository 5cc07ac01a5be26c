package com.example.docxcleaner;

/** 清理流程的统一异常，按 {@link ErrorKind} 区分；entryName 为出错的包内条目（可为 null） */
public class CleanerException extends Exception {

    public enum ErrorKind {
        INVALID_CONTAINER,
        MALFORMED_XML,
        UNSUPPORTED_PART,
        IO_ERROR,
        OUTPUT_EXISTS
    }

    private final ErrorKind kind;
    private final String entryName;

    public CleanerException(ErrorKind kind, String entryName, String message) {
        this(kind, entryName, message, null);
    }

    public CleanerException(ErrorKind kind, String entryName, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.entryName = entryName;
    }

    public ErrorKind getKind() { return kind; }

    public String getEntryName() { return entryName; }

    /** 面向用户的一行描述：[KIND] entry: message */
    public String describe() {
        StringBuilder sb = new StringBuilder();
        sb.append('[').append(kind).append("] ");
        if (entryName != null) sb.append(entryName).append(": ");
        sb.append(getMessage());
        Throwable c = getCause();
        if (c != null && c.getMessage() != null && !c.getMessage().equals(getMessage())) {
            sb.append(" (").append(c.getMessage()).append(')');
        }
        return sb.toString();
    }
}
