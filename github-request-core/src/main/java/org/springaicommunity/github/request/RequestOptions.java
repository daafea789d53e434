package org.springaicommunity.github.request;

import org.jspecify.annotations.Nullable;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-request settings: query parameters, extra headers, body, timeout and streaming.
 *
 * <p>
 * Headers given here override the client's default headers of the same name (compared
 * case-insensitively); mapping a header to {@code null} removes the default for this
 * request only.
 *
 * <pre>
 * {@code
 * RequestOptions options = RequestOptions.builder()
 *     .query("state", "open")
 *     .query("per_page", 100)
 *     .header("Accept", "application/vnd.github.raw+json")
 *     .build();
 * }
 * </pre>
 */
public final class RequestOptions {

	private static final RequestOptions NONE = builder().build();

	private final Map<String, List<String>> query;

	private final Map<String, @Nullable String> headers;

	private final @Nullable Object json;

	private final byte @Nullable [] data;

	private final @Nullable Duration timeout;

	private final boolean stream;

	private RequestOptions(Builder builder) {
		Map<String, List<String>> queryCopy = new LinkedHashMap<>();
		builder.query.forEach((name, values) -> queryCopy.put(name, List.copyOf(values)));
		this.query = Collections.unmodifiableMap(queryCopy);
		this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(builder.headers));
		this.json = builder.json;
		this.data = builder.data;
		this.timeout = builder.timeout;
		this.stream = builder.stream;
	}

	public static RequestOptions none() {
		return NONE;
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Shorthand for options carrying only a JSON body.
	 */
	public static RequestOptions json(@Nullable Object json) {
		return builder().json(json).build();
	}

	/**
	 * Shorthand for options carrying only query parameters.
	 */
	public static RequestOptions query(Map<String, ?> query) {
		return builder().query(query).build();
	}

	public Builder toBuilder() {
		Builder builder = new Builder();
		query.forEach((name, values) -> builder.query.put(name, new ArrayList<>(values)));
		builder.headers.putAll(headers);
		builder.json = json;
		builder.data = data;
		builder.timeout = timeout;
		builder.stream = stream;
		return builder;
	}

	public Map<String, List<String>> getQuery() {
		return query;
	}

	public Map<String, @Nullable String> getHeaders() {
		return headers;
	}

	public @Nullable Object getJson() {
		return json;
	}

	public byte @Nullable [] getData() {
		return data;
	}

	public @Nullable Duration getTimeout() {
		return timeout;
	}

	public boolean isStream() {
		return stream;
	}

	/**
	 * Builder for {@link RequestOptions}.
	 */
	public static final class Builder {

		private final Map<String, List<String>> query = new LinkedHashMap<>();

		private final Map<String, @Nullable String> headers = new LinkedHashMap<>();

		private @Nullable Object json;

		private byte @Nullable [] data;

		private @Nullable Duration timeout;

		private boolean stream;

		private Builder() {
		}

		/**
		 * Add a query parameter. Iterable values add one parameter per element; a
		 * {@code null} value is skipped.
		 * @param name parameter name
		 * @param value parameter value, converted with {@link String#valueOf(Object)}
		 * @return this builder
		 */
		public Builder query(String name, @Nullable Object value) {
			if (value instanceof Iterable<?> values) {
				for (Object element : values) {
					query(name, element);
				}
			}
			else if (value != null) {
				query.computeIfAbsent(name, key -> new ArrayList<>()).add(String.valueOf(value));
			}
			return this;
		}

		/**
		 * Add all entries of {@code params} as query parameters.
		 * @param params parameters to add
		 * @return this builder
		 */
		public Builder query(Map<String, ?> params) {
			params.forEach(this::query);
			return this;
		}

		/**
		 * Remove every query parameter set so far.
		 * @return this builder
		 */
		public Builder clearQuery() {
			query.clear();
			return this;
		}

		/**
		 * Set a header for this request, or suppress a default header with {@code null}.
		 * @param name header name
		 * @param value header value, or {@code null} to send no such header
		 * @return this builder
		 */
		public Builder header(String name, @Nullable String value) {
			headers.put(name, value);
			return this;
		}

		/**
		 * Set several headers at once.
		 * @param values header values, {@code null} values suppress defaults
		 * @return this builder
		 */
		public Builder headers(Map<String, ? extends @Nullable String> values) {
			headers.putAll(values);
			return this;
		}

		/**
		 * Set a body to be serialized as JSON.
		 * @param json any value Jackson can serialize, including a {@code JsonNode}
		 * @return this builder
		 */
		public Builder json(@Nullable Object json) {
			this.json = json;
			return this;
		}

		/**
		 * Set a raw body to be sent as-is.
		 * @param data body bytes
		 * @return this builder
		 */
		public Builder data(byte @Nullable [] data) {
			this.data = data;
			return this;
		}

		/**
		 * @param timeout timeout for each attempt of this request
		 * @return this builder
		 */
		public Builder timeout(@Nullable Duration timeout) {
			this.timeout = timeout;
			return this;
		}

		/**
		 * Leave the response body unread so it can be consumed as a stream.
		 * @param stream whether to stream the response body
		 * @return this builder
		 */
		public Builder stream(boolean stream) {
			this.stream = stream;
			return this;
		}

		/**
		 * Build the options.
		 * @return configured RequestOptions
		 * @throws IllegalStateException if both a JSON and a raw body are set
		 */
		public RequestOptions build() {
			if (json != null && data != null) {
				throw new IllegalStateException("Only one of json() and data() may be set");
			}
			return new RequestOptions(this);
		}

	}

}
