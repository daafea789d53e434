package org.springaicommunity.github.request;

/**
 * Sends HTTP requests on behalf of a {@link GitHubClient}.
 *
 * <p>
 * Implementations return every response they receive, whatever its status; deciding
 * what counts as a failure is left to {@link RetryPolicy}. This keeps the transport
 * swappable for tests and for alternative HTTP stacks.
 */
public interface GitHubTransport extends AutoCloseable {

	/**
	 * Send a request once.
	 * @param request the request to send
	 * @return the response, with any status code
	 * @throws TransportException if no response could be obtained; its
	 * {@link TransportException#isRetryable()} flag tells whether sending again may help
	 * @throws RequestCancelledException if the calling thread is interrupted
	 */
	GitHubResponse send(TransportRequest request);

	/**
	 * Release the transport's resources. The default does nothing.
	 */
	@Override
	default void close() {
	}

}
