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

import java.util.List;

/**
 * Supplies extra response header lines for a new consumer's handshake, for example {@code X-Accel-Buffering: no}
 * or {@code Access-Control-Allow-Origin: *}.
 * <p>
 * Invoked exactly once per consumer, before the header block is terminated. Lines are written in the order returned and must be complete
 * {@code Name: value} lines without any CR or LF characters.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@FunctionalInterface
public interface HeaderDecorator {
	/**
	 * Provides the extra header lines for the consumer which made the given request.
	 *
	 * @param request the request that initiated the consumer connection
	 * @return the extra header lines, possibly empty
	 */
	@NonNull
	List<@NonNull String> extraHeaderLines(@NonNull Request request);
}
