package org.springaicommunity.github.request;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.time.InstantSource;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Carries out one logical request against the GitHub API.
 *
 * <p>
 * For each request the dispatcher resolves the URL against the API base, merges headers,
 * then loops: wait for a mutation slot (mutating methods only), send through the
 * {@link GitHubTransport}, and ask the {@link RetryPolicy} whether to return, retry after
 * a sleep, or give up. Intermediate failures are only logged; the caller sees the final
 * response or a single terminal exception.
 *
 * <p>
 * A dispatcher may be shared between threads. Mutating requests from all threads are
 * paced by the one {@link MutationThrottle}.
 */
public class RequestDispatcher implements AutoCloseable {

	private static final Logger logger = LoggerFactory.getLogger(RequestDispatcher.class);

	static final Set<String> MUTATING_METHODS = Set.of("POST", "PATCH", "PUT", "DELETE");

	private final GitHubTransport transport;

	private final String apiUrl;

	private final Map<String, String> sessionHeaders;

	private final RetryPolicy retryPolicy;

	private final MutationThrottle mutationThrottle;

	private final ObjectMapper objectMapper;

	private final InstantSource clock;

	private final Sleeper sleeper;

	private final AtomicBoolean closed = new AtomicBoolean();

	private volatile @Nullable RateLimitInfo lastRateLimitInfo;

	public RequestDispatcher(GitHubTransport transport, String apiUrl, Map<String, String> sessionHeaders,
			RetryPolicy retryPolicy, MutationThrottle mutationThrottle, ObjectMapper objectMapper, InstantSource clock,
			Sleeper sleeper) {
		this.transport = transport;
		this.apiUrl = apiUrl;
		this.sessionHeaders = Collections.unmodifiableMap(new LinkedHashMap<>(sessionHeaders));
		this.retryPolicy = retryPolicy;
		this.mutationThrottle = mutationThrottle;
		this.objectMapper = objectMapper;
		this.clock = clock;
		this.sleeper = sleeper;
	}

	public String getApiUrl() {
		return apiUrl;
	}

	public Map<String, String> getSessionHeaders() {
		return sessionHeaders;
	}

	public ObjectMapper getObjectMapper() {
		return objectMapper;
	}

	/**
	 * Rate limit reported by the most recent response, or {@code null} if no response
	 * has carried rate limit headers yet.
	 */
	public @Nullable RateLimitInfo getLastRateLimitInfo() {
		return lastRateLimitInfo;
	}

	public boolean isClosed() {
		return closed.get();
	}

	/**
	 * Perform a request and decode its JSON body.
	 * @param method HTTP method, case-insensitive
	 * @param url path relative to the API base, or an absolute URL
	 * @param options query, headers and body
	 * @return the decoded body, or {@code null} if the response has no content
	 * @throws GitHubHttpException if the final response has an error status
	 * @throws TransportException if no response could be obtained
	 * @throws GitHubDecodeException if the body is not valid JSON
	 * @throws IllegalArgumentException if {@code options} ask for a streamed body; use
	 * {@link #send} for those
	 */
	public @Nullable JsonNode request(String method, String url, RequestOptions options) {
		if (options.isStream()) {
			throw new IllegalArgumentException("Streamed responses are not decoded; use send() for " + url);
		}
		return decode(send(method, url, options));
	}

	/**
	 * Perform a request and return the successful response without decoding it. With
	 * {@link RequestOptions#isStream()} the body is left unread.
	 * @param method HTTP method, case-insensitive
	 * @param url path relative to the API base, or an absolute URL
	 * @param options query, headers and body
	 * @return the response
	 * @throws GitHubHttpException if the final response has an error status
	 * @throws TransportException if no response could be obtained
	 */
	public GitHubResponse send(String method, String url, RequestOptions options) {
		ensureOpen();
		TransportRequest request = prepare(method.toUpperCase(Locale.ROOT), url, options);
		boolean mutating = MUTATING_METHODS.contains(request.method());
		logger.debug("{} {}", request.method(), request.uri());

		Instant start = null;
		for (int attempt = 1;; attempt++) {
			waitForMutationSlot(mutating);
			ensureOpen();
			if (start == null) {
				start = clock.instant();
			}

			AttemptOutcome outcome;
			GitHubResponse response = null;
			try {
				response = transport.send(request);
				recordRateLimit(response);
				if (response.statusCode() == 403) {
					// the rate limit check reads the body
					response.bytes();
				}
				outcome = AttemptOutcome.response(response);
			}
			catch (TransportException e) {
				outcome = AttemptOutcome.failure(e);
			}

			RetryDecision decision = retryPolicy.evaluate(outcome, attempt,
					Duration.between(start, clock.instant()));
			if (decision instanceof RetryDecision.Success && response != null) {
				logger.debug("{} {} completed in {}ms after {} attempt(s)", request.method(), request.uri(),
						Duration.between(start, clock.instant()).toMillis(), attempt);
				return response;
			}
			if (decision instanceof RetryDecision.Retry retry) {
				logRetry(request, outcome, retry.delay());
				if (response != null) {
					discard(response);
				}
				sleep(retry.delay(), "Retry wait interrupted");
				continue;
			}

			String reason = decision instanceof RetryDecision.GiveUp giveUp ? giveUp.reason() : "unknown";
			logger.debug("Giving up on {} {}: {}", request.method(), request.uri(), reason);
			if (outcome instanceof AttemptOutcome.TransportFailure failure) {
				throw failure.error();
			}
			throw GitHubHttpException.of(((AttemptOutcome.Response) outcome).response(), objectMapper);
		}
	}

	/**
	 * Decode a response body as JSON.
	 * @return the decoded value, or {@code null} for a 204 or a blank body
	 * @throws GitHubDecodeException if the body is not valid JSON
	 */
	public @Nullable JsonNode decode(GitHubResponse response) {
		if (response.statusCode() == 204) {
			return null;
		}
		String text = response.text();
		if (text.isBlank()) {
			return null;
		}
		try {
			return objectMapper.readTree(text);
		}
		catch (JsonProcessingException e) {
			throw new GitHubDecodeException(response.uri().toString(), text, e);
		}
	}

	@Override
	public void close() {
		if (closed.compareAndSet(false, true)) {
			logger.debug("Closing dispatcher for {}", apiUrl);
			transport.close();
		}
	}

	private void ensureOpen() {
		if (closed.get()) {
			throw new ClosedClientException();
		}
	}

	private TransportRequest prepare(String method, String url, RequestOptions options) {
		String resolved = GitHubUrls.withQuery(GitHubUrls.join(apiUrl, url), options.getQuery());
		URI uri;
		try {
			uri = URI.create(resolved);
		}
		catch (IllegalArgumentException e) {
			throw new TransportException("Invalid URL " + resolved + ": " + e.getMessage(), e, false);
		}

		Map<String, String> headers = new LinkedHashMap<>(sessionHeaders);
		options.getHeaders().forEach((name, value) -> {
			headers.keySet().removeIf(existing -> existing.equalsIgnoreCase(name));
			if (value != null) {
				headers.put(name, value);
			}
		});

		byte[] body = options.getData();
		if (options.getJson() != null) {
			try {
				body = objectMapper.writeValueAsBytes(options.getJson());
			}
			catch (JsonProcessingException e) {
				throw new IllegalArgumentException("Request body cannot be serialized as JSON: " + e.getMessage(), e);
			}
			if (headers.keySet().stream().noneMatch("Content-Type"::equalsIgnoreCase)) {
				headers.put("Content-Type", "application/json");
			}
		}
		return new TransportRequest(method, uri, headers, body, options.getTimeout(), options.isStream());
	}

	private void waitForMutationSlot(boolean mutating) {
		Duration delay = mutationThrottle.reserve(mutating, clock.instant());
		if (!delay.isZero()) {
			logger.debug("Sleeping for {} between mutating requests", delay);
			sleep(delay, "Mutation delay interrupted");
		}
	}

	private void sleep(Duration duration, String message) {
		try {
			sleeper.sleep(duration);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new RequestCancelledException(message, e);
		}
	}

	private void recordRateLimit(GitHubResponse response) {
		response.rateLimit().ifPresent(info -> {
			this.lastRateLimitInfo = info;
			if (info.remaining() < 100) {
				logger.info("Rate limit low: {}/{} remaining, resets at epoch {}", info.remaining(), info.limit(),
						info.reset());
			}
			else {
				logger.debug("Rate limit: {}/{} remaining, resets at epoch {}", info.remaining(), info.limit(),
						info.reset());
			}
		});
	}

	private static void logRetry(TransportRequest request, AttemptOutcome outcome, Duration wait) {
		double seconds = wait.toNanos() / 1e9;
		if (outcome instanceof AttemptOutcome.Response received) {
			logger.warn("{} {}: server returned {} response; waiting {} seconds and retrying", request.method(),
					request.uri(), received.response().statusCode(), seconds);
		}
		else if (outcome instanceof AttemptOutcome.TransportFailure failure) {
			logger.warn("{} {}: request failed: {}; waiting {} seconds and retrying", request.method(), request.uri(),
					failure.error().getMessage(), seconds);
		}
	}

	private static void discard(GitHubResponse response) {
		try {
			response.close();
		}
		catch (TransportException e) {
			logger.debug("Ignoring failure to close discarded response {}: {}", response, e.getMessage());
		}
	}

}
