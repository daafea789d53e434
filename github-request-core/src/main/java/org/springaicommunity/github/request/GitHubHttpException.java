package org.springaicommunity.github.request;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Map;

/**
 * Thrown when the GitHub API answers with an error status and the request is not (or no
 * longer) retried.
 *
 * <p>
 * The message embeds the response body so that the API's own explanation (validation
 * errors, rate limit notices) is visible without further calls. JSON bodies are
 * pretty-printed:
 *
 * <pre>
 * 404 Client Error: Not Found for URL: https://api.github.com/repos/o/r
 *
 * {
 *   "message" : "Not Found"
 * }
 * </pre>
 */
public class GitHubHttpException extends GitHubRequestException {

	private static final Map<Integer, String> REASONS = Map.ofEntries(Map.entry(400, "Bad Request"),
			Map.entry(401, "Unauthorized"), Map.entry(403, "Forbidden"), Map.entry(404, "Not Found"),
			Map.entry(405, "Method Not Allowed"), Map.entry(409, "Conflict"), Map.entry(410, "Gone"),
			Map.entry(418, "I'm a Teapot"), Map.entry(422, "Unprocessable Entity"), Map.entry(429, "Too Many Requests"),
			Map.entry(500, "Internal Server Error"), Map.entry(501, "Not Implemented"), Map.entry(502, "Bad Gateway"),
			Map.entry(503, "Service Unavailable"), Map.entry(504, "Gateway Timeout"));

	private final int statusCode;

	private final String url;

	private final String responseBody;

	private final transient GitHubResponse response;

	GitHubHttpException(String message, GitHubResponse response, String responseBody) {
		super(message);
		this.statusCode = response.statusCode();
		this.url = response.uri().toString();
		this.responseBody = responseBody;
		this.response = response;
	}

	/**
	 * Build the exception for an error response, pretty-printing a JSON body with the
	 * given mapper.
	 */
	public static GitHubHttpException of(GitHubResponse response, ObjectMapper objectMapper) {
		String body = response.text();
		StringBuilder message = new StringBuilder();
		int status = response.statusCode();
		message.append(status).append(' ').append(errorKind(status)).append(" Error: ");
		message.append(REASONS.getOrDefault(status, "Unknown"));
		message.append(" for URL: ").append(response.uri());
		if (!body.isBlank()) {
			message.append("\n\n").append(prettyBody(body, objectMapper));
		}
		return new GitHubHttpException(message.toString(), response, body);
	}

	private static String errorKind(int status) {
		if (status >= 400 && status < 500) {
			return "Client";
		}
		if (status >= 500 && status < 600) {
			return "Server";
		}
		return "Unknown";
	}

	private static String prettyBody(String body, ObjectMapper objectMapper) {
		try {
			JsonNode node = objectMapper.readTree(body);
			return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(node);
		}
		catch (JsonProcessingException e) {
			return body;
		}
	}

	public int getStatusCode() {
		return statusCode;
	}

	public String getUrl() {
		return url;
	}

	public String getResponseBody() {
		return responseBody;
	}

	public GitHubResponse getResponse() {
		return response;
	}

	/**
	 * Returns true if this exception represents a rate limit error (403 or 429 with no
	 * requests remaining, or a body mentioning the rate limit).
	 */
	public boolean isRateLimitError() {
		if (statusCode != 403 && statusCode != 429) {
			return false;
		}
		return response.rateLimit().map(RateLimitInfo::isExceeded).orElse(false)
				|| RetryPolicy.mentionsRateLimit(responseBody);
	}

}
