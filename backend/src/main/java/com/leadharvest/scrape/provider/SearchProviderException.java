package com.leadharvest.scrape.provider;

public class SearchProviderException extends Exception {
    public enum Kind {
        TRANSIENT,
        FATAL
    }

    private final Kind kind;
    private final Integer httpStatus;

    public SearchProviderException(Kind kind, String message) {
        this(kind, message, null, null);
    }

    public SearchProviderException(Kind kind, String message, Integer httpStatus, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.httpStatus = httpStatus;
    }

    public static SearchProviderException transientError(String message) {
        return new SearchProviderException(Kind.TRANSIENT, message);
    }

    public static SearchProviderException fatal(String message) {
        return new SearchProviderException(Kind.FATAL, message);
    }

    public Kind kind() {
        return kind;
    }

    public Integer httpStatus() {
        return httpStatus;
    }

    public boolean isTransient() {
        return kind == Kind.TRANSIENT;
    }
}
