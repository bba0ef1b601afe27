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
import java.time.Duration;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Invokes a {@link LifecycleObserver}, converting any exception it throws into a {@link LogEvent}.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
@ThreadSafe
final class SafeLifecycleObserver implements LifecycleObserver {
	@NonNull
	private final LifecycleObserver lifecycleObserver;

	SafeLifecycleObserver(@NonNull LifecycleObserver lifecycleObserver) {
		requireNonNull(lifecycleObserver);
		this.lifecycleObserver = lifecycleObserver;
	}

	@Override
	public void didEstablishConsumer(@NonNull Consumer consumer) {
		try {
			getLifecycleObserver().didEstablishConsumer(consumer);
		} catch (Throwable t) {
			didReceiveLogEvent(failureLogEvent(LogEventType.LIFECYCLE_OBSERVER_DID_ESTABLISH_CONSUMER_FAILED, "didEstablishConsumer", t)
					.consumer(consumer)
					.build());
		}
	}

	@Override
	public void didFailToEstablishConsumer(@NonNull Request request,
																				 @NonNull Throwable throwable) {
		try {
			getLifecycleObserver().didFailToEstablishConsumer(request, throwable);
		} catch (Throwable t) {
			didReceiveLogEvent(failureLogEvent(LogEventType.LIFECYCLE_OBSERVER_DID_ESTABLISH_CONSUMER_FAILED, "didFailToEstablishConsumer", t)
					.request(request)
					.build());
		}
	}

	@Override
	public void willTerminateConsumer(@NonNull Consumer consumer,
																		Consumer.@NonNull TerminationReason terminationReason,
																		@Nullable Throwable throwable) {
		try {
			getLifecycleObserver().willTerminateConsumer(consumer, terminationReason, throwable);
		} catch (Throwable t) {
			didReceiveLogEvent(failureLogEvent(LogEventType.LIFECYCLE_OBSERVER_WILL_TERMINATE_CONSUMER_FAILED, "willTerminateConsumer", t)
					.consumer(consumer)
					.build());
		}
	}

	@Override
	public void didTerminateConsumer(@NonNull Consumer consumer,
																	 @NonNull Duration connectionDuration,
																	 Consumer.@NonNull TerminationReason terminationReason,
																	 @Nullable Throwable throwable) {
		try {
			getLifecycleObserver().didTerminateConsumer(consumer, connectionDuration, terminationReason, throwable);
		} catch (Throwable t) {
			didReceiveLogEvent(failureLogEvent(LogEventType.LIFECYCLE_OBSERVER_DID_TERMINATE_CONSUMER_FAILED, "didTerminateConsumer", t)
					.consumer(consumer)
					.build());
		}
	}

	@Override
	public void didWriteMessage(@NonNull Consumer consumer,
															@NonNull Message message,
															@NonNull Duration writeDuration) {
		try {
			getLifecycleObserver().didWriteMessage(consumer, message, writeDuration);
		} catch (Throwable t) {
			didReceiveLogEvent(failureLogEvent(LogEventType.LIFECYCLE_OBSERVER_DID_WRITE_MESSAGE_FAILED, "didWriteMessage", t)
					.consumer(consumer)
					.build());
		}
	}

	@Override
	public void didFailToWriteMessage(@NonNull Consumer consumer,
																		@NonNull Message message,
																		@NonNull Duration writeDuration,
																		@NonNull Throwable throwable) {
		try {
			getLifecycleObserver().didFailToWriteMessage(consumer, message, writeDuration, throwable);
		} catch (Throwable t) {
			didReceiveLogEvent(failureLogEvent(LogEventType.LIFECYCLE_OBSERVER_DID_WRITE_MESSAGE_FAILED, "didFailToWriteMessage", t)
					.consumer(consumer)
					.build());
		}
	}

	@Override
	public void didDropMessage(@NonNull Consumer consumer,
														 @NonNull Message message) {
		try {
			getLifecycleObserver().didDropMessage(consumer, message);
		} catch (Throwable t) {
			didReceiveLogEvent(failureLogEvent(LogEventType.LIFECYCLE_OBSERVER_DID_DROP_MESSAGE_FAILED, "didDropMessage", t)
					.consumer(consumer)
					.build());
		}
	}

	@Override
	public void didShutdown(@NonNull EventSource eventSource) {
		try {
			getLifecycleObserver().didShutdown(eventSource);
		} catch (Throwable t) {
			didReceiveLogEvent(failureLogEvent(LogEventType.LIFECYCLE_OBSERVER_DID_SHUTDOWN_FAILED, "didShutdown", t).build());
		}
	}

	@Override
	public void didReceiveLogEvent(@NonNull LogEvent logEvent) {
		requireNonNull(logEvent);

		try {
			getLifecycleObserver().didReceiveLogEvent(logEvent);
		} catch (Throwable throwable) {
			// The observer can't even log; nowhere left to report but stderr
			throwable.printStackTrace(System.err);
		}
	}

	private LogEvent.@NonNull Builder failureLogEvent(@NonNull LogEventType logEventType,
																					 @NonNull String methodName,
																					 @NonNull Throwable throwable) {
		requireNonNull(logEventType);
		requireNonNull(methodName);
		requireNonNull(throwable);

		return LogEvent.with(logEventType, format("An exception occurred while invoking %s::%s",
				LifecycleObserver.class.getSimpleName(), methodName)).throwable(throwable);
	}

	@NonNull
	LifecycleObserver getLifecycleObserver() {
		return this.lifecycleObserver;
	}
}
