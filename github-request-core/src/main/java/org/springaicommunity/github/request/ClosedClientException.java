package org.springaicommunity.github.request;

/**
 * Thrown when a request is attempted through a {@link GitHubClient} that has been closed.
 */
public class ClosedClientException extends GitHubRequestException {

	public ClosedClientException() {
		super("GitHubClient has been closed");
	}

}
