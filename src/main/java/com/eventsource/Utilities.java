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

import javax.annotation.concurrent.ThreadSafe;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.regex.Pattern;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Internal helpers shared across the library.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
final class Utilities {
	@NonNull
	private static final Pattern HEAD_WHITESPACE_PATTERN;
	@NonNull
	private static final Pattern TAIL_WHITESPACE_PATTERN;
	@NonNull
	private static final Set<@NonNull String> COMMA_JOINABLE_HEADER_NAMES;

	static {
		// \p{Z} is any kind of whitespace or invisible separator; \s picks up CR, LF and TAB
		HEAD_WHITESPACE_PATTERN = Pattern.compile("^(\\p{Z}|\\s)+");
		TAIL_WHITESPACE_PATTERN = Pattern.compile("(\\p{Z}|\\s)+$");

		COMMA_JOINABLE_HEADER_NAMES = Set.of(
				"accept",
				"accept-encoding",
				"accept-language",
				"cache-control",
				"connection",
				"pragma",
				"te",
				"upgrade",
				"via"
		);
	}

	private Utilities() {
		// Non-instantiable
	}

	/**
	 * A "stronger" version of {@link String#trim()} which discards any kind of whitespace or invisible separator,
	 * for example a trailing {@code U+202F} pasted in from a word processor.
	 *
	 * @param string the string to trim
	 * @return the trimmed string, or {@code null} if the input string is {@code null}
	 */
	@Nullable
	static String trimAggressively(@Nullable String string) {
		if (string == null)
			return null;

		string = HEAD_WHITESPACE_PATTERN.matcher(string).replaceAll("");

		if (string.length() == 0)
			return string;

		return TAIL_WHITESPACE_PATTERN.matcher(string).replaceAll("");
	}

	@Nullable
	static String trimAggressivelyToNull(@Nullable String string) {
		if (string == null)
			return null;

		string = trimAggressively(string);
		return string.length() == 0 ? null : string;
	}

	@NonNull
	static String trimAggressivelyToEmpty(@Nullable String string) {
		if (string == null)
			return "";

		return trimAggressively(string);
	}

	/**
	 * Given raw {@code Name: value} header lines, builds a case-insensitive map of header values.
	 * <p>
	 * Values of list-type headers like {@code Accept-Encoding} are split on commas that are not inside a quoted string.
	 * Lines without a colon or without a value are skipped. Value order is preserved.
	 *
	 * @param rawHeaderLines the raw header lines, without line terminators
	 * @return the parsed headers
	 */
	@NonNull
	static Map<@NonNull String, @NonNull Set<@NonNull String>> extractHeadersFromRawHeaderLines(@NonNull List<@NonNull String> rawHeaderLines) {
		requireNonNull(rawHeaderLines);

		Map<String, Set<String>> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);

		for (String rawHeaderLine : rawHeaderLines) {
			String line = trimAggressivelyToNull(rawHeaderLine);

			if (line == null)
				continue;

			int indexOfColon = line.indexOf(':');

			if (indexOfColon <= 0)
				continue;

			String name = trimAggressivelyToEmpty(line.substring(0, indexOfColon));
			String value = trimAggressivelyToNull(line.substring(indexOfColon + 1));

			if (value == null)
				continue;

			Set<String> values = headers.computeIfAbsent(name, (ignored) -> new LinkedHashSet<>());

			if (COMMA_JOINABLE_HEADER_NAMES.contains(name.toLowerCase(Locale.ENGLISH))) {
				for (String component : splitCommaAware(value)) {
					component = trimAggressivelyToNull(component);

					if (component != null)
						values.add(component);
				}
			} else {
				values.add(value);
			}
		}

		return headers;
	}

	@NonNull
	private static List<@NonNull String> splitCommaAware(@NonNull String string) {
		requireNonNull(string);

		List<String> components = new ArrayList<>(4);
		StringBuilder current = new StringBuilder();
		boolean inQuotes = false;
		boolean escaped = false;

		for (int i = 0; i < string.length(); i++) {
			char c = string.charAt(i);

			if (escaped) {
				current.append(c);
				escaped = false;
			} else if (c == '\\') {
				current.append(c);
				escaped = inQuotes;
			} else if (c == '"') {
				inQuotes = !inQuotes;
				current.append(c);
			} else if (c == ',' && !inQuotes) {
				components.add(current.toString());
				current.setLength(0);
			} else {
				current.append(c);
			}
		}

		components.add(current.toString());
		return components;
	}

	@NonNull
	static String printableString(@NonNull String input) {
		requireNonNull(input);

		StringBuilder out = new StringBuilder(input.length() + 16);

		for (int i = 0; i < input.length(); i++)
			out.append(printableChar(input.charAt(i)));

		return out.toString();
	}

	@NonNull
	static String printableChar(char c) {
		if (c == '\r') return "\\r";
		if (c == '\n') return "\\n";
		if (c == '\t') return "\\t";
		if (c == '\\') return "\\\\";
		if (c == '\"') return "\\\"";
		if (c == 0) return "\\0";

		if (Character.isISOControl(c) || Character.getType(c) == Character.FORMAT)
			return format("\\u%04X", (int) c);

		return String.valueOf(c);
	}

	/**
	 * Vends a factory for daemon threads named {@code <prefix>-<n>}.
	 *
	 * @param threadNamePrefix the thread name prefix
	 * @return the thread factory
	 */
	@NonNull
	static ThreadFactory createDaemonThreadFactory(@NonNull String threadNamePrefix) {
		requireNonNull(threadNamePrefix);
		return new DaemonThreadFactory(threadNamePrefix);
	}

	@ThreadSafe
	private static final class DaemonThreadFactory implements ThreadFactory {
		@NonNull
		private final String namePrefix;
		@NonNull
		private final AtomicInteger idGenerator;

		private DaemonThreadFactory(@NonNull String namePrefix) {
			requireNonNull(namePrefix);

			this.namePrefix = namePrefix;
			this.idGenerator = new AtomicInteger(0);
		}

		@Override
		@NonNull
		public Thread newThread(@NonNull Runnable runnable) {
			Thread thread = new Thread(runnable, format("%s-%d", this.namePrefix, this.idGenerator.incrementAndGet()));
			// Never block JVM exit
			thread.setDaemon(true);
			return thread;
		}
	}
}
