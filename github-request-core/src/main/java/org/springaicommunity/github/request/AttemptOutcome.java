package org.springaicommunity.github.request;

/**
 * The result of sending a request once: either the transport failed, or a response came
 * back (with any status).
 */
public sealed interface AttemptOutcome permits AttemptOutcome.TransportFailure, AttemptOutcome.Response {

	static AttemptOutcome failure(TransportException error) {
		return new TransportFailure(error);
	}

	static AttemptOutcome response(GitHubResponse response) {
		return new Response(response);
	}

	/**
	 * No response was received.
	 */
	record TransportFailure(TransportException error) implements AttemptOutcome {

		public boolean isRetryable() {
			return error.isRetryable();
		}

	}

	/**
	 * A response was received; its status decides whether it counts as a failure.
	 */
	record Response(GitHubResponse response) implements AttemptOutcome {
	}

}
