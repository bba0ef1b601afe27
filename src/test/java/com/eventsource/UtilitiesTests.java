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

import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class UtilitiesTests {
	@Test
	public void headersFromRawHeaderLines() {
		Map<String, Set<String>> headers = Utilities.extractHeadersFromRawHeaderLines(List.of(
				"Host: localhost:8080",
				"Accept-Encoding: gzip, deflate, br",
				"X-Quoted: \"a, b\"",
				"malformed line",
				"X-Empty:"
		));

		assertEquals(Set.of("localhost:8080"), headers.get("host"), "Header lookup should be case-insensitive");
		assertEquals(List.of("gzip", "deflate", "br"), List.copyOf(headers.get("Accept-Encoding")), "List-type header should be split in order");
		assertEquals(Set.of("\"a, b\""), headers.get("X-Quoted"), "Only list-type headers should be split");
		assertNull(headers.get("X-Empty"), "Headers without values should be skipped");
		assertEquals(3, headers.size());
	}

	@Test
	public void trimAggressively() {
		assertEquals("test", Utilities.trimAggressively("  test \t"));
		assertNull(Utilities.trimAggressivelyToNull("   "));
		assertEquals("", Utilities.trimAggressivelyToEmpty(null));
	}

	@Test
	public void printableString() {
		assertEquals("a\\r\\nb", Utilities.printableString("a\r\nb"));
	}
}
