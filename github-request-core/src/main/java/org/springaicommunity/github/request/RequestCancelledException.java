package org.springaicommunity.github.request;

/**
 * Thrown when the calling thread is interrupted while a request is sleeping between
 * attempts or waiting on the transport. The thread's interrupt flag is restored before
 * this is thrown.
 */
public class RequestCancelledException extends GitHubRequestException {

	public RequestCancelledException(String message, InterruptedException cause) {
		super(message, cause);
	}

}
