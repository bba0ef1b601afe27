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

/**
 * Kinds of {@link LogEvent} instances that an {@link EventSource} or {@link EventSourceServer} can produce.
 *
 * @author <a href="https://www.revetkn.com">Mark Allen</a>
 */
public enum LogEventType {
	/**
	 * Indicates that the handshake response could not be written to a new consumer's connection.
	 */
	CONSUMER_HANDSHAKE_FAILED,
	/**
	 * Indicates that a consumer's connection could not be closed cleanly.
	 */
	CONSUMER_CLOSE_FAILED,
	/**
	 * Indicates that an unexpected exception escaped a consumer's delivery loop.
	 */
	CONSUMER_DELIVERY_FAILED,
	/**
	 * Indicates that consumer delivery loops did not finish within the shutdown timeout and were interrupted.
	 */
	EVENT_SOURCE_SHUTDOWN_TIMED_OUT,
	/**
	 * Indicates {@link LifecycleObserver#didEstablishConsumer(Consumer)} or {@link LifecycleObserver#didFailToEstablishConsumer(Request, Throwable)} threw an exception.
	 */
	LIFECYCLE_OBSERVER_DID_ESTABLISH_CONSUMER_FAILED,
	/**
	 * Indicates {@link LifecycleObserver#willTerminateConsumer(Consumer, Consumer.TerminationReason, Throwable)} threw an exception.
	 */
	LIFECYCLE_OBSERVER_WILL_TERMINATE_CONSUMER_FAILED,
	/**
	 * Indicates {@link LifecycleObserver#didTerminateConsumer(Consumer, java.time.Duration, Consumer.TerminationReason, Throwable)} threw an exception.
	 */
	LIFECYCLE_OBSERVER_DID_TERMINATE_CONSUMER_FAILED,
	/**
	 * Indicates {@link LifecycleObserver#didWriteMessage(Consumer, Message, java.time.Duration)} or
	 * {@link LifecycleObserver#didFailToWriteMessage(Consumer, Message, java.time.Duration, Throwable)} threw an exception.
	 */
	LIFECYCLE_OBSERVER_DID_WRITE_MESSAGE_FAILED,
	/**
	 * Indicates {@link LifecycleObserver#didDropMessage(Consumer, Message)} threw an exception.
	 */
	LIFECYCLE_OBSERVER_DID_DROP_MESSAGE_FAILED,
	/**
	 * Indicates {@link LifecycleObserver#didShutdown(EventSource)} threw an exception.
	 */
	LIFECYCLE_OBSERVER_DID_SHUTDOWN_FAILED,
	/**
	 * Indicates that the {@link EventSourceServer} received a request with an illegal structure, such as a malformed request line.
	 */
	SERVER_UNPARSEABLE_REQUEST,
	/**
	 * Indicates that the {@link EventSourceServer} was unable to hand a connection to its {@link EventSource}.
	 */
	SERVER_CONNECTION_REJECTED,
	/**
	 * Indicates an internal {@link EventSourceServer} error occurred.
	 */
	SERVER_INTERNAL_ERROR
}
