package org.springaicommunity.github.request;

import org.jspecify.annotations.Nullable;

import java.io.ByteArrayInputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpHeaders;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * An HTTP response received from the GitHub API.
 *
 * <p>
 * The body is either buffered up front or, for streamed requests, held as an open
 * {@link InputStream}. A streamed body is read into memory the first time
 * {@link #bytes()} or {@link #text()} is called; callers wanting to consume it
 * incrementally should use {@link #bodyStream()} and {@link #close()} the response when
 * done.
 */
public final class GitHubResponse implements Closeable {

	private static final Pattern LINK_VALUE = Pattern.compile("<([^>]*)>((?:\\s*;\\s*[^;,]+)*)");

	private static final Pattern REL_PARAM = Pattern.compile("rel\\s*=\\s*\"?([^\";]+)\"?", Pattern.CASE_INSENSITIVE);

	private final String method;

	private final URI uri;

	private final int statusCode;

	private final HttpHeaders headers;

	private byte @Nullable [] body;

	private @Nullable InputStream stream;

	private @Nullable Map<String, String> links;

	private GitHubResponse(String method, URI uri, int statusCode, HttpHeaders headers, byte @Nullable [] body,
			@Nullable InputStream stream) {
		this.method = method;
		this.uri = uri;
		this.statusCode = statusCode;
		this.headers = headers;
		this.body = body;
		this.stream = stream;
	}

	/**
	 * Create a response whose body has already been read.
	 */
	public static GitHubResponse buffered(String method, URI uri, int statusCode, HttpHeaders headers, byte[] body) {
		return new GitHubResponse(method, uri, statusCode, headers, body, null);
	}

	/**
	 * Create a response whose body is still to be read from {@code stream}.
	 */
	public static GitHubResponse streamed(String method, URI uri, int statusCode, HttpHeaders headers,
			InputStream stream) {
		return new GitHubResponse(method, uri, statusCode, headers, null, stream);
	}

	public String method() {
		return method;
	}

	public URI uri() {
		return uri;
	}

	public int statusCode() {
		return statusCode;
	}

	public HttpHeaders headers() {
		return headers;
	}

	public Optional<String> header(String name) {
		return headers.firstValue(name);
	}

	public boolean isSuccessful() {
		return statusCode >= 200 && statusCode < 300;
	}

	public Optional<RateLimitInfo> rateLimit() {
		return RateLimitInfo.fromHeaders(headers);
	}

	/**
	 * Return the response body, reading a streamed body fully if it has not been read
	 * yet.
	 * @throws TransportException if reading a streamed body fails
	 */
	public synchronized byte[] bytes() {
		if (body == null) {
			InputStream in = stream;
			stream = null;
			if (in == null) {
				throw new IllegalStateException("Response body of " + uri + " was already handed out as a stream");
			}
			try (in) {
				body = in.readAllBytes();
			}
			catch (IOException e) {
				throw new TransportException("Failed to read response body from " + uri + ": " + e.getMessage(), e,
						true);
			}
		}
		return body;
	}

	/**
	 * Return the response body decoded as UTF-8.
	 */
	public String text() {
		return new String(bytes(), StandardCharsets.UTF_8);
	}

	/**
	 * Return the body as a stream. For a streamed response the underlying stream is
	 * handed out once and the response no longer buffers it.
	 */
	public synchronized InputStream bodyStream() {
		if (body != null) {
			return new ByteArrayInputStream(body);
		}
		InputStream in = stream;
		if (in == null) {
			throw new IllegalStateException("Response body of " + uri + " was already handed out as a stream");
		}
		stream = null;
		return in;
	}

	/**
	 * Parse the {@code Link} header into a map from relation name to URL. When a link
	 * declares several space-separated relations it is registered under each of them.
	 */
	public synchronized Map<String, String> links() {
		if (links == null) {
			Map<String, String> parsed = new LinkedHashMap<>();
			for (String value : headers.allValues("Link")) {
				Matcher matcher = LINK_VALUE.matcher(value);
				while (matcher.find()) {
					Matcher rel = REL_PARAM.matcher(matcher.group(2));
					if (rel.find()) {
						for (String name : rel.group(1).trim().split("\\s+")) {
							parsed.putIfAbsent(name, matcher.group(1).trim());
						}
					}
				}
			}
			links = Collections.unmodifiableMap(parsed);
		}
		return links;
	}

	/**
	 * Return the URL of the next page, if this response is part of a paginated listing.
	 */
	public Optional<String> nextPageUrl() {
		return Optional.ofNullable(links().get("next"));
	}

	@Override
	public synchronized void close() {
		InputStream in = stream;
		stream = null;
		if (in != null) {
			try {
				in.close();
			}
			catch (IOException e) {
				throw new TransportException("Failed to close response body from " + uri, e, false);
			}
		}
	}

	@Override
	public String toString() {
		return "GitHubResponse[" + method + " " + uri + " -> " + statusCode + "]";
	}

	static HttpHeaders toHeaders(Map<String, List<String>> values) {
		return HttpHeaders.of(values, (name, value) -> true);
	}

}
