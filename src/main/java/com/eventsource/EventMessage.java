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
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * An event message: the {@code id}, {@code event} and {@code data} fields of a Server-Sent Event.
 * <p>
 * For example:
 * <pre>{@code EventMessage eventMessage = EventMessage.withData("{\"value\": 123}")
 *   .event("example")
 *   .id("1")
 *   .build();}</pre>
 * <p>
 * Every field is optional; a {@code null} field is normalized to the empty string and empty fields are omitted from the wire.
 * Field values are stored exactly as supplied. Sanitizing (for example, stripping newlines from {@code id}) happens at encoding time,
 * see {@link MessageEncoder}.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
public final class EventMessage implements Message {
	@NonNull
	private final String id;
	@NonNull
	private final String event;
	@NonNull
	private final String data;

	/**
	 * Acquires a builder for {@link EventMessage} instances, seeded with a {@code data} value.
	 *
	 * @param data the {@code data} value for the instance
	 * @return the builder
	 */
	@NonNull
	public static Builder withData(@Nullable String data) {
		return new Builder().data(data);
	}

	/**
	 * Acquires a builder for {@link EventMessage} instances, seeded with an {@code event} value.
	 *
	 * @param event the {@code event} value for the instance
	 * @return the builder
	 */
	@NonNull
	public static Builder withEvent(@Nullable String event) {
		return new Builder().event(event);
	}

	/**
	 * Acquires an "empty" builder for {@link EventMessage} instances.
	 *
	 * @return the builder
	 */
	@NonNull
	public static Builder withDefaults() {
		return new Builder();
	}

	protected EventMessage(@NonNull Builder builder) {
		requireNonNull(builder);

		this.id = builder.id == null ? "" : builder.id;
		this.event = builder.event == null ? "" : builder.event;
		this.data = builder.data == null ? "" : builder.data;
	}

	/**
	 * Builder used to construct instances of {@link EventMessage}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @author <a href="https://www.revetkn.com">Mark Allen</a>
	 */
	@NotThreadSafe
	public static final class Builder {
		@Nullable
		private String id;
		@Nullable
		private String event;
		@Nullable
		private String data;

		protected Builder() {
			// Nothing to do
		}

		@NonNull
		public Builder id(@Nullable String id) {
			this.id = id;
			return this;
		}

		@NonNull
		public Builder event(@Nullable String event) {
			this.event = event;
			return this;
		}

		@NonNull
		public Builder data(@Nullable String data) {
			this.data = data;
			return this;
		}

		@NonNull
		public EventMessage build() {
			return new EventMessage(this);
		}
	}

	@Override
	@NonNull
	public String toString() {
		List<String> components = new ArrayList<>(3);

		if (this.id.length() > 0)
			components.add(format("id=%s", Utilities.printableString(this.id)));
		if (this.event.length() > 0)
			components.add(format("event=%s", Utilities.printableString(this.event)));
		if (this.data.length() > 0)
			components.add(format("data=%s", Utilities.printableString(this.data)));

		return format("%s{%s}", getClass().getSimpleName(), components.stream().collect(Collectors.joining(", ")));
	}

	@Override
	public boolean equals(@Nullable Object object) {
		if (this == object)
			return true;

		if (!(object instanceof EventMessage eventMessage))
			return false;

		return Objects.equals(getId(), eventMessage.getId())
				&& Objects.equals(getEvent(), eventMessage.getEvent())
				&& Objects.equals(getData(), eventMessage.getData());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getId(), getEvent(), getData());
	}

	/**
	 * The {@code id} for this event, used by clients to populate the {@code Last-Event-ID} request header should a reconnect occur.
	 *
	 * @return the {@code id}, or the empty string if none was specified
	 */
	@NonNull
	public String getId() {
		return this.id;
	}

	/**
	 * The {@code event} type for this event.
	 *
	 * @return the {@code event} type, or the empty string if none was specified
	 */
	@NonNull
	public String getEvent() {
		return this.event;
	}

	/**
	 * The {@code data} payload for this event. May span multiple lines.
	 *
	 * @return the {@code data} payload, or the empty string if none was specified
	 */
	@NonNull
	public String getData() {
		return this.data;
	}
}
