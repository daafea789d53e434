package org.springaicommunity.github.request;

import com.fasterxml.jackson.databind.JsonNode;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.BiFunction;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Lazily walks a paginated GitHub listing by following {@code rel="next"} links.
 *
 * <p>
 * The first page is fetched with the caller's query parameters; every later page is
 * fetched from the absolute {@code next} URL exactly as the server gave it, which already
 * carries the query. Iteration ends on the first page without a {@code next} link.
 *
 * <p>
 * Pages are only requested when the items of the previous page have been consumed, so
 * stopping early costs nothing. The iterator is single-pass and not thread-safe.
 *
 * @param <T> {@link JsonNode} items, or whole {@link GitHubResponse} pages
 */
public final class PaginationIterator<T> implements Iterator<T> {

	private static final Logger logger = LoggerFactory.getLogger(PaginationIterator.class);

	private enum State {

		INIT, FETCHING, EXHAUSTED

	}

	private final RequestDispatcher dispatcher;

	private final String path;

	private final RequestOptions firstPageOptions;

	private final RequestOptions nextPageOptions;

	private final BiFunction<RequestDispatcher, GitHubResponse, List<T>> pageContents;

	private State state = State.INIT;

	private @Nullable String nextUrl;

	private Iterator<T> current = Collections.emptyIterator();

	private int pages;

	private PaginationIterator(RequestDispatcher dispatcher, String path, RequestOptions options,
			BiFunction<RequestDispatcher, GitHubResponse, List<T>> pageContents) {
		this.dispatcher = dispatcher;
		this.path = path;
		this.firstPageOptions = options.toBuilder().stream(false).build();
		this.nextPageOptions = options.toBuilder().stream(false).clearQuery().build();
		this.pageContents = pageContents;
	}

	/**
	 * Iterate over the items of every page. Each page must be a JSON array, or an object
	 * with exactly one array-valued field (as the search endpoints return, next to
	 * {@code total_count}).
	 * @param dispatcher dispatcher used to fetch pages
	 * @param path first page path or URL
	 * @param options query and headers for the first request; headers apply to all pages
	 * @return iterator over the items
	 */
	public static PaginationIterator<JsonNode> items(RequestDispatcher dispatcher, String path,
			RequestOptions options) {
		return new PaginationIterator<>(dispatcher, path, options, PaginationIterator::extractItems);
	}

	/**
	 * Iterate over the raw pages.
	 * @param dispatcher dispatcher used to fetch pages
	 * @param path first page path or URL
	 * @param options query and headers for the first request; headers apply to all pages
	 * @return iterator over the page responses
	 */
	public static PaginationIterator<GitHubResponse> pages(RequestDispatcher dispatcher, String path,
			RequestOptions options) {
		return new PaginationIterator<>(dispatcher, path, options, (d, response) -> List.of(response));
	}

	@Override
	public boolean hasNext() {
		while (!current.hasNext()) {
			if (state == State.EXHAUSTED) {
				return false;
			}
			fetchPage();
		}
		return true;
	}

	@Override
	public T next() {
		if (!hasNext()) {
			throw new NoSuchElementException("No more pages after " + pages + " page(s) of " + path);
		}
		return current.next();
	}

	/**
	 * The remaining elements as a sequential stream backed by this iterator.
	 */
	public Stream<T> stream() {
		return StreamSupport.stream(Spliterators.spliteratorUnknownSize(this, Spliterator.ORDERED), false);
	}

	private void fetchPage() {
		GitHubResponse response;
		if (state == State.INIT) {
			response = dispatcher.send("GET", path, firstPageOptions);
		}
		else {
			response = dispatcher.send("GET", requireNextUrl(), nextPageOptions);
		}
		pages++;
		nextUrl = response.nextPageUrl().orElse(null);
		state = nextUrl != null ? State.FETCHING : State.EXHAUSTED;
		logger.debug("Fetched page {} of {}{}", pages, path, nextUrl != null ? "; next: " + nextUrl : "");
		current = pageContents.apply(dispatcher, response).iterator();
	}

	private String requireNextUrl() {
		String url = nextUrl;
		if (url == null) {
			throw new IllegalStateException("No next page URL for " + path);
		}
		return url;
	}

	private static List<JsonNode> extractItems(RequestDispatcher dispatcher, GitHubResponse response) {
		JsonNode body = dispatcher.decode(response);
		if (body != null && body.isArray()) {
			return elements(body);
		}
		if (body != null && body.isObject()) {
			List<JsonNode> lists = new ArrayList<>();
			Iterator<Map.Entry<String, JsonNode>> fields = body.fields();
			while (fields.hasNext()) {
				JsonNode value = fields.next().getValue();
				if (value.isArray()) {
					lists.add(value);
				}
			}
			if (lists.size() == 1) {
				return elements(lists.get(0));
			}
			throw new PaginationShapeException("Expected exactly one list field in paginated response from "
					+ response.uri() + ", found " + lists.size());
		}
		throw new PaginationShapeException("Paginated response from " + response.uri()
				+ " is neither a JSON array nor an object: " + (body == null ? "empty body" : body.getNodeType()));
	}

	private static List<JsonNode> elements(JsonNode array) {
		List<JsonNode> items = new ArrayList<>(array.size());
		array.forEach(items::add);
		return items;
	}

}
