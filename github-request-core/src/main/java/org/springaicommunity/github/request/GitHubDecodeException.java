package org.springaicommunity.github.request;

/**
 * Thrown when a response body that should hold JSON cannot be parsed.
 */
public class GitHubDecodeException extends GitHubRequestException {

	private final String body;

	public GitHubDecodeException(String url, String body, Throwable cause) {
		super("Response from " + url + " is not valid JSON: " + cause.getMessage(), cause);
		this.body = body;
	}

	public String getBody() {
		return body;
	}

}
