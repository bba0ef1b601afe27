/*
 * Copyright 2022-2026 Revetware LLC.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.eventsource;

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;
import javax.annotation.concurrent.ThreadSafe;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Metadata for the HTTP request that initiated a consumer connection.
 * <p>
 * The broadcaster itself only uses a request to decide on extra response headers (via {@link HeaderDecorator})
 * and on compression (via {@link CompressionPolicy}). Header names are case-insensitive.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class Request {
	@NonNull
	private final String httpMethod;
	@NonNull
	private final String uri;
	@NonNull
	private final Map<@NonNull String, @NonNull Set<@NonNull String>> headers;

	/**
	 * Acquires a builder for {@link Request} instances.
	 *
	 * @param httpMethod the HTTP method, e.g. {@code GET}
	 * @param uri        the request URI, e.g. {@code /events?channel=1}
	 * @return the builder
	 */
	@NonNull
	public static Builder with(@NonNull String httpMethod,
														 @NonNull String uri) {
		requireNonNull(httpMethod);
		requireNonNull(uri);

		return new Builder(httpMethod, uri);
	}

	protected Request(@NonNull Builder builder) {
		requireNonNull(builder);

		this.httpMethod = builder.httpMethod;
		this.uri = builder.uri;

		Map<String, Set<String>> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);

		if (builder.headers != null)
			for (Entry<String, Set<String>> entry : builder.headers.entrySet())
				headers.computeIfAbsent(entry.getKey(), (ignored) -> new LinkedHashSet<>())
						.addAll(entry.getValue() == null ? Set.of() : entry.getValue());

		// Freeze the value sets too
		headers.replaceAll((name, values) -> Collections.unmodifiableSet(values));

		this.headers = Collections.unmodifiableMap(headers);
	}

	/**
	 * Builder used to construct instances of {@link Request}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 */
	@NotThreadSafe
	public static final class Builder {
		@NonNull
		private final String httpMethod;
		@NonNull
		private final String uri;
		@Nullable
		private Map<@NonNull String, @Nullable Set<@NonNull String>> headers;

		protected Builder(@NonNull String httpMethod,
											@NonNull String uri) {
			requireNonNull(httpMethod);
			requireNonNull(uri);

			this.httpMethod = httpMethod;
			this.uri = uri;
		}

		@NonNull
		public Builder headers(@Nullable Map<@NonNull String, @Nullable Set<@NonNull String>> headers) {
			this.headers = headers;
			return this;
		}

		@NonNull
		public Request build() {
			return new Request(this);
		}
	}

	/**
	 * Convenience accessor for the first value of the named header.
	 *
	 * @param name the case-insensitive header name
	 * @return the first header value, or {@link Optional#empty()} if the header is absent or has no values
	 */
	@NonNull
	public Optional<String> getHeader(@NonNull String name) {
		requireNonNull(name);

		Set<String> values = getHeaders().get(name);

		if (values == null || values.isEmpty())
			return Optional.empty();

		return Optional.of(values.iterator().next());
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{httpMethod=%s, uri=%s}", getClass().getSimpleName(), getHttpMethod(), getUri());
	}

	@NonNull
	public String getHttpMethod() {
		return this.httpMethod;
	}

	@NonNull
	public String getUri() {
		return this.uri;
	}

	/**
	 * Request headers keyed on case-insensitive name. Values keep their original order.
	 *
	 * @return the request headers
	 */
	@NonNull
	public Map<@NonNull String, @NonNull Set<@NonNull String>> getHeaders() {
		return this.headers;
	}
}
