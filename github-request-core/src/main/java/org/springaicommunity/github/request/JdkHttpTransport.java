package org.springaicommunity.github.request;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * {@link GitHubTransport} backed by the JDK's {@link HttpClient}.
 *
 * <p>
 * I/O failures (refused connections, resets, timeouts) are reported as retryable
 * {@link TransportException}s; requests the client refuses to build or send (unsupported
 * scheme, illegal header) as non-retryable ones.
 */
public class JdkHttpTransport implements GitHubTransport {

	private static final Logger logger = LoggerFactory.getLogger(JdkHttpTransport.class);

	private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(30);

	// Set by HttpClient itself; rejected when supplied by callers.
	private static final Set<String> RESTRICTED_HEADERS = Set.of("connection", "content-length", "expect", "host",
			"upgrade");

	private final HttpClient httpClient;

	public JdkHttpTransport() {
		this(HttpClient.newBuilder()
			.connectTimeout(CONNECT_TIMEOUT)
			.followRedirects(HttpClient.Redirect.NORMAL)
			.build());
	}

	public JdkHttpTransport(HttpClient httpClient) {
		this.httpClient = httpClient;
	}

	@Override
	public GitHubResponse send(TransportRequest request) {
		HttpRequest httpRequest = buildRequest(request);
		long start = System.currentTimeMillis();
		try {
			GitHubResponse response;
			if (request.stream()) {
				HttpResponse<InputStream> httpResponse = httpClient.send(httpRequest,
						HttpResponse.BodyHandlers.ofInputStream());
				response = GitHubResponse.streamed(request.method(), httpResponse.uri(), httpResponse.statusCode(),
						httpResponse.headers(), httpResponse.body());
			}
			else {
				HttpResponse<byte[]> httpResponse = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofByteArray());
				response = GitHubResponse.buffered(request.method(), httpResponse.uri(), httpResponse.statusCode(),
						httpResponse.headers(), httpResponse.body());
			}
			logger.debug("{} {} -> {} in {}ms", request.method(), request.uri(), response.statusCode(),
					System.currentTimeMillis() - start);
			return response;
		}
		catch (IOException e) {
			logger.debug("{} {} failed after {}ms: {}", request.method(), request.uri(),
					System.currentTimeMillis() - start, e.toString());
			throw new TransportException("HTTP request failed: " + e, e, true);
		}
		catch (IllegalArgumentException e) {
			throw new TransportException("Invalid request for " + request.uri() + ": " + e.getMessage(), e, false);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new RequestCancelledException("HTTP request interrupted", e);
		}
	}

	private HttpRequest buildRequest(TransportRequest request) {
		try {
			HttpRequest.Builder builder = HttpRequest.newBuilder(request.uri());
			if (request.timeout() != null) {
				builder.timeout(request.timeout());
			}
			for (Map.Entry<String, String> header : request.headers().entrySet()) {
				if (RESTRICTED_HEADERS.contains(header.getKey().toLowerCase(Locale.ROOT))) {
					logger.debug("Dropping restricted header {}", header.getKey());
					continue;
				}
				builder.header(header.getKey(), header.getValue());
			}
			byte[] body = request.body();
			HttpRequest.BodyPublisher publisher = body != null ? HttpRequest.BodyPublishers.ofByteArray(body)
					: HttpRequest.BodyPublishers.noBody();
			return builder.method(request.method(), publisher).build();
		}
		catch (IllegalArgumentException | IllegalStateException e) {
			throw new TransportException("Invalid request for " + request.uri() + ": " + e.getMessage(), e, false);
		}
	}

	@Override
	public void close() {
		// HttpClient only became AutoCloseable in JDK 21; its threads exit once it is
		// unreachable.
		logger.debug("Closing JDK HTTP transport");
	}

}
