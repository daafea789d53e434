package org.springaicommunity.github.request;

/**
 * Thrown when a paginated response is neither a JSON array nor an object with exactly one
 * array-valued field.
 */
public class PaginationShapeException extends GitHubRequestException {

	public PaginationShapeException(String message) {
		super(message);
	}

}
