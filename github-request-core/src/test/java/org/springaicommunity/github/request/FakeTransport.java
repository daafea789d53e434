package org.springaicommunity.github.request;

import java.io.InputStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Transport replaying scripted responses and failures in order, recording every request
 * together with the clock time it was sent at.
 */
final class FakeTransport implements GitHubTransport {

	private final MutableClock clock;

	private final Deque<Object> script = new ArrayDeque<>();

	private final List<TransportRequest> requests = new ArrayList<>();

	private final List<Instant> sendTimes = new ArrayList<>();

	private boolean closed;

	FakeTransport(MutableClock clock) {
		this.clock = clock;
	}

	/**
	 * Queue a response.
	 * @param status status code
	 * @param body response body
	 * @param headers alternating header names and values
	 * @return this transport
	 */
	FakeTransport respond(int status, String body, String... headers) {
		Map<String, List<String>> values = new LinkedHashMap<>();
		for (int i = 0; i < headers.length; i += 2) {
			values.computeIfAbsent(headers[i], key -> new ArrayList<>()).add(headers[i + 1]);
		}
		script.add(new ScriptedResponse(status, body, values));
		return this;
	}

	/**
	 * Queue a response whose body is read from {@code body} on demand.
	 */
	FakeTransport respondStreamed(int status, InputStream body) {
		script.add(new StreamedResponse(status, body));
		return this;
	}

	FakeTransport fail(TransportException failure) {
		script.add(failure);
		return this;
	}

	@Override
	public synchronized GitHubResponse send(TransportRequest request) {
		requests.add(request);
		sendTimes.add(clock.instant());
		Object next = script.poll();
		if (next == null) {
			throw new AssertionError("Unexpected request " + request.method() + " " + request.uri());
		}
		if (next instanceof TransportException failure) {
			throw failure;
		}
		if (next instanceof StreamedResponse streamed) {
			return GitHubResponse.streamed(request.method(), request.uri(), streamed.status(),
					GitHubResponse.toHeaders(Map.of()), streamed.body());
		}
		ScriptedResponse scripted = (ScriptedResponse) next;
		return GitHubResponse.buffered(request.method(), request.uri(), scripted.status(),
				GitHubResponse.toHeaders(scripted.headers()), scripted.body().getBytes(StandardCharsets.UTF_8));
	}

	@Override
	public void close() {
		closed = true;
	}

	synchronized List<TransportRequest> requests() {
		return List.copyOf(requests);
	}

	synchronized TransportRequest lastRequest() {
		return requests.get(requests.size() - 1);
	}

	synchronized List<URI> uris() {
		return requests.stream().map(TransportRequest::uri).toList();
	}

	synchronized List<Instant> sendTimes() {
		return List.copyOf(sendTimes);
	}

	boolean isClosed() {
		return closed;
	}

	int remaining() {
		return script.size();
	}

	private record ScriptedResponse(int status, String body, Map<String, List<String>> headers) {
	}

	private record StreamedResponse(int status, InputStream body) {
	}

}
