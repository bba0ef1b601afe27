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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public class MessageEncoderTests {
	@Test
	public void dataOnly() {
		assertEquals("data: test\n\n", encode("test", "", ""));
	}

	@Test
	public void idAndData() {
		assertEquals("id: 1\ndata: test\n\n", encode("test", "", "1"));
	}

	@Test
	public void newlinesAreStrippedFromId() {
		assertEquals("id: 11\ndata: test\n\n", encode("test", "", "1\n1"));
	}

	@Test
	public void newlinesAreStrippedFromEvent() {
		assertEquals("id: 1\nevent: notification2\ndata: test\n\n", encode("test", "notification\n2", "1"));
	}

	@Test
	public void multilineDataKeepsTrailingEmptyLine() {
		assertEquals("data: test\ndata: test2\ndata: test3\ndata: \n\n", encode("test\ntest2\ntest3\n", "", ""));
	}

	@Test
	public void fieldOrderIsIdEventData() {
		assertEquals("id: 7\nevent: update\ndata: {\"a\":1}\n\n", encode("{\"a\":1}", "update", "7"));
	}

	@Test
	public void emptyFieldsAreOmitted() {
		assertEquals("\n", encode("", "", ""));
		assertEquals("\n", encode(null, null, null));
		assertEquals("event: ping\n\n", encode("", "ping", ""));
	}

	@Test
	public void retry() {
		String encoded = MessageEncoder.encodeToString(RetryMessage.withInterval(Duration.ofSeconds(3)));
		assertEquals("retry: 3000\n\n", encoded);
	}

	@Test
	public void retryTruncatesToWholeMilliseconds() {
		String encoded = MessageEncoder.encodeToString(RetryMessage.withInterval(Duration.ofNanos(1_500_999)));
		assertEquals("retry: 1\n\n", encoded);
	}

	@Test
	public void negativeRetryIsRejected() {
		Assertions.assertThrows(IllegalArgumentException.class, () -> RetryMessage.withInterval(Duration.ofMillis(-1)));
	}

	@Test
	public void encodesUtf8() {
		byte[] bytes = MessageEncoder.encode(EventMessage.withData("héllo ☃").build());
		assertEquals("data: héllo ☃\n\n", new String(bytes, StandardCharsets.UTF_8));
	}

	@Test
	public void encodingDoesNotMutateMessage() {
		EventMessage eventMessage = EventMessage.withData("a\nb")
				.id("1\n2")
				.build();

		MessageEncoder.encode(eventMessage);

		assertEquals("1\n2", eventMessage.getId(), "Message fields should be stored as supplied");
		assertEquals("a\nb", eventMessage.getData());
	}

	private String encode(String data, String event, String id) {
		return MessageEncoder.encodeToString(EventMessage.withData(data)
				.event(event)
				.id(id)
				.build());
	}
}
