package org.springaicommunity.github.request;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.InstantSource;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Client for the GitHub REST API.
 *
 * <p>
 * Paths are resolved against the API base URL; absolute URLs (such as those found in
 * API responses) are used as they are. Failed and rate-limited requests are retried
 * according to the {@link RetryConfig}, and mutating requests are spaced at least
 * {@code mutationDelay} apart.
 *
 * <p>
 * Example usage:
 *
 * <pre>
 * {@code
 * try (GitHubClient client = GitHubClient.builder().tokenFromEnv().build()) {
 *     JsonNode repo = client.get("/repos/spring-projects/spring-ai");
 *
 *     client.paginate("/repos/spring-projects/spring-ai/issues",
 *             RequestOptions.query(Map.of("state", "open", "per_page", 100)))
 *         .forEachRemaining(issue -> System.out.println(issue.path("title").asText()));
 *
 *     Endpoint labels = client.endpoint("repos").child("owner", "repo", "labels");
 *     labels.post(Map.of("name", "triage", "color", "ededed"));
 * }
 * }
 * </pre>
 */
public class GitHubClient implements AutoCloseable {

	private static final Logger logger = LoggerFactory.getLogger(GitHubClient.class);

	public static final String DEFAULT_ACCEPT = "application/vnd.github+json";

	public static final String DEFAULT_API_VERSION = "2022-11-28";

	public static final Duration DEFAULT_MUTATION_DELAY = Duration.ofSeconds(1);

	private final RequestDispatcher dispatcher;

	/**
	 * Private constructor - use {@link #builder()} to create instances.
	 */
	private GitHubClient(RequestDispatcher dispatcher) {
		this.dispatcher = dispatcher;
	}

	/**
	 * Create a new builder for GitHubClient.
	 * @return new Builder instance
	 */
	public static Builder builder() {
		return new Builder();
	}

	public String getApiUrl() {
		return dispatcher.getApiUrl();
	}

	/**
	 * Headers sent with every request unless overridden per call.
	 */
	public Map<String, String> getDefaultHeaders() {
		return dispatcher.getSessionHeaders();
	}

	public ObjectMapper getObjectMapper() {
		return dispatcher.getObjectMapper();
	}

	/**
	 * Get the rate limit information from the most recent API response.
	 * @return last observed RateLimitInfo, or null
	 */
	public @Nullable RateLimitInfo getLastRateLimitInfo() {
		return dispatcher.getLastRateLimitInfo();
	}

	/**
	 * Create an {@link Endpoint} for {@code path}, from which sub-resources can be
	 * derived.
	 * @param path path relative to the API base, or an absolute URL
	 * @return the endpoint
	 */
	public Endpoint endpoint(String path) {
		return new Endpoint(this, GitHubUrls.join(getApiUrl(), path));
	}

	/**
	 * Perform a request and decode the JSON response.
	 * @param method HTTP method
	 * @param path path relative to the API base, or an absolute URL
	 * @param options query, headers and body
	 * @return decoded body, or {@code null} if the response has no content
	 * @throws IllegalArgumentException if {@code options} ask for a streamed body
	 */
	public @Nullable JsonNode request(String method, String path, RequestOptions options) {
		return dispatcher.request(method, path, options);
	}

	/**
	 * Perform a request and return the raw response. Use
	 * {@link RequestOptions.Builder#stream(boolean)} to leave the body unread.
	 * @param method HTTP method
	 * @param path path relative to the API base, or an absolute URL
	 * @param options query, headers and body
	 * @return the successful response
	 */
	public GitHubResponse send(String method, String path, RequestOptions options) {
		return dispatcher.send(method, path, options);
	}

	public @Nullable JsonNode get(String path) {
		return request("GET", path, RequestOptions.none());
	}

	public @Nullable JsonNode get(String path, RequestOptions options) {
		return request("GET", path, options);
	}

	public @Nullable JsonNode post(String path, @Nullable Object json) {
		return request("POST", path, RequestOptions.json(json));
	}

	public @Nullable JsonNode post(String path, RequestOptions options) {
		return request("POST", path, options);
	}

	public @Nullable JsonNode put(String path, @Nullable Object json) {
		return request("PUT", path, RequestOptions.json(json));
	}

	public @Nullable JsonNode put(String path, RequestOptions options) {
		return request("PUT", path, options);
	}

	public @Nullable JsonNode patch(String path, @Nullable Object json) {
		return request("PATCH", path, RequestOptions.json(json));
	}

	public @Nullable JsonNode patch(String path, RequestOptions options) {
		return request("PATCH", path, options);
	}

	public @Nullable JsonNode delete(String path) {
		return request("DELETE", path, RequestOptions.none());
	}

	public @Nullable JsonNode delete(String path, RequestOptions options) {
		return request("DELETE", path, options);
	}

	/**
	 * Iterate over all items of a paginated listing.
	 * @param path path relative to the API base, or an absolute URL
	 * @return lazy iterator over the items of all pages
	 */
	public PaginationIterator<JsonNode> paginate(String path) {
		return paginate(path, RequestOptions.none());
	}

	/**
	 * Iterate over all items of a paginated listing.
	 * @param path path relative to the API base, or an absolute URL
	 * @param options query parameters (first page only) and headers (all pages)
	 * @return lazy iterator over the items of all pages
	 */
	public PaginationIterator<JsonNode> paginate(String path, RequestOptions options) {
		return PaginationIterator.items(dispatcher, path, options);
	}

	/**
	 * Iterate over the pages of a paginated listing as raw responses.
	 * @param path path relative to the API base, or an absolute URL
	 * @param options query parameters (first page only) and headers (all pages)
	 * @return lazy iterator over the page responses
	 */
	public PaginationIterator<GitHubResponse> paginateRaw(String path, RequestOptions options) {
		return PaginationIterator.pages(dispatcher, path, options);
	}

	public boolean isClosed() {
		return dispatcher.isClosed();
	}

	/**
	 * Release the transport. Any later request fails with
	 * {@link ClosedClientException}. Closing twice has no further effect.
	 */
	@Override
	public void close() {
		dispatcher.close();
	}

	/**
	 * Builder for {@link GitHubClient}.
	 *
	 * <p>
	 * Provides sensible defaults:
	 * <ul>
	 * <li>apiUrl: {@code $GITHUB_API_URL}, else https://api.github.com</li>
	 * <li>accept: application/vnd.github+json</li>
	 * <li>apiVersion: 2022-11-28</li>
	 * <li>mutationDelay: 1 second</li>
	 * <li>retryConfig: {@link RetryConfig#defaults()}</li>
	 * </ul>
	 */
	public static class Builder {

		private @Nullable String apiUrl;

		private @Nullable String token;

		private @Nullable String userAgent;

		private @Nullable String accept = DEFAULT_ACCEPT;

		private @Nullable String apiVersion = DEFAULT_API_VERSION;

		private final Map<String, String> headers = new LinkedHashMap<>();

		private boolean setHeaders = true;

		private Duration mutationDelay = DEFAULT_MUTATION_DELAY;

		private RetryConfig retryConfig = RetryConfig.defaults();

		private @Nullable GitHubTransport transport;

		private @Nullable ObjectMapper objectMapper;

		private InstantSource clock = InstantSource.system();

		private Sleeper sleeper = Sleeper.SYSTEM;

		private DoubleSupplier random = () -> ThreadLocalRandom.current().nextDouble();

		private Builder() {
		}

		/**
		 * Set the base URL of the API.
		 * @param apiUrl base URL, e.g. {@code https://github.example.com/api/v3}
		 * @return this builder
		 */
		public Builder apiUrl(String apiUrl) {
			this.apiUrl = apiUrl;
			return this;
		}

		/**
		 * Read the base URL from {@code GITHUB_API_URL}, falling back to the public API.
		 * @return this builder
		 */
		public Builder apiUrlFromEnv() {
			this.apiUrl = GitHubEnvironment.apiUrl();
			return this;
		}

		/**
		 * Set the token sent as {@code Authorization: Bearer <token>}.
		 * @param token GitHub access token, or null for unauthenticated requests
		 * @return this builder
		 */
		public Builder token(@Nullable String token) {
			this.token = token;
			return this;
		}

		/**
		 * Read the GitHub token from the GITHUB_TOKEN environment variable.
		 * @return this builder
		 * @throws IllegalStateException if GITHUB_TOKEN is not set
		 */
		public Builder tokenFromEnv() {
			String value = GitHubEnvironment.token();
			if (value == null || value.isBlank()) {
				throw new IllegalStateException(
						"GITHUB_TOKEN environment variable is required. Please set your GitHub personal access token.");
			}
			this.token = value;
			return this;
		}

		/**
		 * @param userAgent User-Agent header value, or null for the transport's default
		 * @return this builder
		 */
		public Builder userAgent(@Nullable String userAgent) {
			this.userAgent = userAgent;
			return this;
		}

		/**
		 * @param accept Accept header value, or null to send none (default:
		 * application/vnd.github+json)
		 * @return this builder
		 */
		public Builder accept(@Nullable String accept) {
			this.accept = accept;
			return this;
		}

		/**
		 * @param apiVersion X-GitHub-Api-Version header value, or null to send none
		 * (default: 2022-11-28)
		 * @return this builder
		 */
		public Builder apiVersion(@Nullable String apiVersion) {
			this.apiVersion = apiVersion;
			return this;
		}

		/**
		 * Add a header sent with every request. Extra headers take precedence over the
		 * standard ones of the same name.
		 * @param name header name
		 * @param value header value
		 * @return this builder
		 */
		public Builder header(String name, String value) {
			this.headers.put(name, value);
			return this;
		}

		/**
		 * Add several headers sent with every request.
		 * @param headers headers to add
		 * @return this builder
		 */
		public Builder headers(Map<String, String> headers) {
			this.headers.putAll(headers);
			return this;
		}

		/**
		 * Whether to send any default headers at all. When false, requests carry only
		 * the headers given per call.
		 * @param setHeaders whether to install default headers (default: true)
		 * @return this builder
		 */
		public Builder setHeaders(boolean setHeaders) {
			this.setHeaders = setHeaders;
			return this;
		}

		/**
		 * @param mutationDelay minimum spacing between mutating requests (default: 1
		 * second)
		 * @return this builder
		 */
		public Builder mutationDelay(Duration mutationDelay) {
			this.mutationDelay = mutationDelay;
			return this;
		}

		/**
		 * @param retryConfig retry settings (default: {@link RetryConfig#defaults()})
		 * @return this builder
		 */
		public Builder retryConfig(RetryConfig retryConfig) {
			this.retryConfig = retryConfig;
			return this;
		}

		/**
		 * Set a custom transport. Useful for testing with mocks or for adding
		 * decorators.
		 * @param transport transport to send requests with (null to use
		 * {@link JdkHttpTransport})
		 * @return this builder
		 */
		public Builder transport(@Nullable GitHubTransport transport) {
			this.transport = transport;
			return this;
		}

		/**
		 * @param objectMapper Jackson ObjectMapper (null to use
		 * {@link ObjectMapperFactory#create()})
		 * @return this builder
		 */
		public Builder objectMapper(@Nullable ObjectMapper objectMapper) {
			this.objectMapper = objectMapper;
			return this;
		}

		/**
		 * @param clock time source for mutation pacing and retry budgets (mainly for
		 * testing)
		 * @return this builder
		 */
		public Builder clock(InstantSource clock) {
			this.clock = clock;
			return this;
		}

		/**
		 * @param sleeper how to wait between attempts (mainly for testing)
		 * @return this builder
		 */
		public Builder sleeper(Sleeper sleeper) {
			this.sleeper = sleeper;
			return this;
		}

		/**
		 * @param random source of backoff jitter in {@code [0, 1)} (mainly for testing)
		 * @return this builder
		 */
		public Builder random(DoubleSupplier random) {
			this.random = random;
			return this;
		}

		/**
		 * Build the GitHubClient.
		 * @return configured GitHubClient
		 * @throws IllegalStateException if the configuration is invalid
		 */
		public GitHubClient build() {
			String url = apiUrl != null ? apiUrl : GitHubEnvironment.apiUrl();
			if (url.isBlank()) {
				throw new IllegalStateException("apiUrl must not be blank");
			}
			if (mutationDelay.isNegative()) {
				throw new IllegalStateException("mutationDelay must be non-negative");
			}
			GitHubTransport httpTransport = transport != null ? transport : new JdkHttpTransport();
			ObjectMapper mapper = objectMapper != null ? objectMapper : ObjectMapperFactory.create();
			RetryPolicy retryPolicy = new RetryPolicy(retryConfig, clock, random);
			MutationThrottle throttle = new MutationThrottle(mutationDelay);
			logger.debug("Creating GitHubClient for {} (mutation delay {}, max retries {})", url, mutationDelay,
					retryConfig.maxRetries());
			return new GitHubClient(new RequestDispatcher(httpTransport, url, defaultHeaders(), retryPolicy, throttle,
					mapper, clock, sleeper));
		}

		private Map<String, String> defaultHeaders() {
			Map<String, String> result = new LinkedHashMap<>();
			if (!setHeaders) {
				return result;
			}
			if (accept != null) {
				result.put("Accept", accept);
			}
			if (token != null) {
				result.put("Authorization", "Bearer " + token);
			}
			if (userAgent != null) {
				result.put("User-Agent", userAgent);
			}
			if (apiVersion != null) {
				result.put("X-GitHub-Api-Version", apiVersion);
			}
			headers.forEach((name, value) -> {
				result.keySet().removeIf(existing -> existing.equalsIgnoreCase(name));
				result.put(name, value);
			});
			return result;
		}

	}

}
