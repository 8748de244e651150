package org.springaicommunity.timeline.collector;

import org.jspecify.annotations.Nullable;

/**
 * Exception raised by sources, normalizers and collectors. The {@link ErrorKind} decides
 * how the engine reacts.
 */
public class CollectionException extends RuntimeException {

	private final ErrorKind kind;

	private final int statusCode;

	public CollectionException(ErrorKind kind, String message) {
		this(kind, message, -1, null);
	}

	public CollectionException(ErrorKind kind, String message, @Nullable Throwable cause) {
		this(kind, message, -1, cause);
	}

	public CollectionException(ErrorKind kind, String message, int statusCode) {
		this(kind, message, statusCode, null);
	}

	public CollectionException(ErrorKind kind, String message, int statusCode, @Nullable Throwable cause) {
		super(message, cause);
		this.kind = kind;
		this.statusCode = statusCode;
	}

	public ErrorKind kind() {
		return kind;
	}

	/**
	 * Returns the HTTP status code that caused the failure, or -1 when not applicable.
	 * @return the status code
	 */
	public int statusCode() {
		return statusCode;
	}

	public static CollectionException rateLimited(String message) {
		return new CollectionException(ErrorKind.RATE_LIMIT, message);
	}

	public static CollectionException transientFailure(String message, @Nullable Throwable cause) {
		return new CollectionException(ErrorKind.TRANSIENT_NETWORK, message, cause);
	}

	public static CollectionException authentication(String message) {
		return new CollectionException(ErrorKind.AUTHENTICATION, message);
	}

	public static CollectionException parse(String message) {
		return new CollectionException(ErrorKind.RECORD_PARSE, message);
	}

	public static CollectionException configuration(String message) {
		return new CollectionException(ErrorKind.CONFIGURATION, message);
	}

}
