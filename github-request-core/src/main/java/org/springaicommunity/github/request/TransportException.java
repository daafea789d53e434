package org.springaicommunity.github.request;

/**
 * Failure to obtain any HTTP response at all (connection refused, timeout, malformed
 * request).
 *
 * <p>
 * Connection-level problems are {@linkplain #isRetryable() retryable}; errors caused by
 * the request itself (bad URI, unsupported scheme, illegal header) are not, since sending
 * the same request again cannot succeed.
 */
public class TransportException extends GitHubRequestException {

	private final boolean retryable;

	public TransportException(String message, Throwable cause, boolean retryable) {
		super(message, cause);
		this.retryable = retryable;
	}

	public TransportException(String message, boolean retryable) {
		super(message);
		this.retryable = retryable;
	}

	public boolean isRetryable() {
		return retryable;
	}

}
