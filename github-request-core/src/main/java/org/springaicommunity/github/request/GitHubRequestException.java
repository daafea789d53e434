package org.springaicommunity.github.request;

/**
 * Base class for all failures surfaced by {@link GitHubClient}.
 *
 * <p>
 * Retries are resolved internally; callers only ever see the terminal failure of a
 * request.
 */
public class GitHubRequestException extends RuntimeException {

	public GitHubRequestException(String message) {
		super(message);
	}

	public GitHubRequestException(String message, Throwable cause) {
		super(message, cause);
	}

}
