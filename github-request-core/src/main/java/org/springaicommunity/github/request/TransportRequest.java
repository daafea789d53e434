package org.springaicommunity.github.request;

import org.jspecify.annotations.Nullable;

import java.net.URI;
import java.time.Duration;
import java.util.Map;

/**
 * A fully resolved request, ready to hand to a {@link GitHubTransport}.
 *
 * @param method upper-case HTTP method
 * @param uri absolute URI including the query string
 * @param headers headers to send, already merged with the client's defaults
 * @param body request body, or {@code null} for none
 * @param timeout per-request timeout, or {@code null} for the transport's default
 * @param stream whether the response body should be left unread for the caller
 */
public record TransportRequest(String method, URI uri, Map<String, String> headers, byte @Nullable [] body,
		@Nullable Duration timeout, boolean stream) {

	public TransportRequest {
		headers = Map.copyOf(headers);
	}

}
