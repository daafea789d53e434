package org.springaicommunity.github.request;

import com.fasterxml.jackson.databind.JsonNode;
import org.jspecify.annotations.Nullable;

/**
 * A resource URL bound to a {@link GitHubClient}.
 *
 * <p>
 * Endpoints are cheap values: {@link #child(String...)} derives sub-resources without
 * any request being made, and all endpoints derived from one client share its headers,
 * retry settings and mutation pacing.
 *
 * <pre>
 * {@code
 * Endpoint repo = client.endpoint("repos").child("octocat", "hello-world");
 * JsonNode info = repo.get();
 * repo.child("issues").post(Map.of("title", "Found a bug"));
 * }
 * </pre>
 *
 * @param client client performing the requests
 * @param url absolute URL of the resource
 */
public record Endpoint(GitHubClient client, String url) {

	/**
	 * Derive a sub-resource by appending path segments, one slash between each.
	 * @param segments path segments, e.g. {@code "issues", "42", "comments"}
	 * @return the sub-resource endpoint
	 */
	public Endpoint child(String... segments) {
		String result = url;
		for (String segment : segments) {
			result = GitHubUrls.join(result, segment);
		}
		return new Endpoint(client, result);
	}

	public @Nullable JsonNode request(String method, RequestOptions options) {
		return client.request(method, url, options);
	}

	public GitHubResponse send(String method, RequestOptions options) {
		return client.send(method, url, options);
	}

	public @Nullable JsonNode get() {
		return client.get(url);
	}

	public @Nullable JsonNode get(RequestOptions options) {
		return client.get(url, options);
	}

	public @Nullable JsonNode post(@Nullable Object json) {
		return client.post(url, json);
	}

	public @Nullable JsonNode post(RequestOptions options) {
		return client.post(url, options);
	}

	public @Nullable JsonNode put(@Nullable Object json) {
		return client.put(url, json);
	}

	public @Nullable JsonNode put(RequestOptions options) {
		return client.put(url, options);
	}

	public @Nullable JsonNode patch(@Nullable Object json) {
		return client.patch(url, json);
	}

	public @Nullable JsonNode patch(RequestOptions options) {
		return client.patch(url, options);
	}

	public @Nullable JsonNode delete() {
		return client.delete(url);
	}

	public @Nullable JsonNode delete(RequestOptions options) {
		return client.delete(url, options);
	}

	public PaginationIterator<JsonNode> paginate() {
		return client.paginate(url);
	}

	public PaginationIterator<JsonNode> paginate(RequestOptions options) {
		return client.paginate(url, options);
	}

	public PaginationIterator<GitHubResponse> paginateRaw(RequestOptions options) {
		return client.paginateRaw(url, options);
	}

	@Override
	public String toString() {
		return "Endpoint[" + url + "]";
	}

}
