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

import java.util.Locale;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * Decides, once per consumer, whether its stream is gzip-compressed.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@FunctionalInterface
public interface CompressionPolicy {
	/**
	 * Should the consumer which made the given request receive a gzip-compressed stream?
	 *
	 * @param request  the request that initiated the consumer connection
	 * @param settings the settings of the event source accepting the consumer
	 * @return {@code true} if the stream should be compressed
	 */
	@NonNull
	Boolean shouldCompress(@NonNull Request request,
												 @NonNull Settings settings);

	/**
	 * Acquires the default policy: compress if {@link Settings#getGzip()} is enabled and any {@code Accept-Encoding} request header value mentions {@code gzip}.
	 *
	 * @return the default compression policy
	 */
	@NonNull
	static CompressionPolicy defaultInstance() {
		return (request, settings) -> {
			requireNonNull(request);
			requireNonNull(settings);

			if (!settings.getGzip())
				return false;

			Set<String> acceptEncodings = request.getHeaders().getOrDefault("Accept-Encoding", Set.of());

			for (String acceptEncoding : acceptEncodings)
				if (acceptEncoding.toLowerCase(Locale.ENGLISH).contains("gzip"))
					return true;

			return false;
		};
	}

	/**
	 * Acquires a policy which never compresses.
	 *
	 * @return the "never compress" policy
	 */
	@NonNull
	static CompressionPolicy disabledInstance() {
		return (request, settings) -> false;
	}
}
