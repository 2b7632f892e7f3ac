/*
 * Copyright 2015-2022 Transmogrify LLC, 2022-2025 Revetware LLC.
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

package com.keyspan;

import org.jspecify.annotations.NonNull;

/**
 * Contract for sending CQL text to a cluster and getting textual rows back.
 * <p>
 * Statements carry no bind markers: every value has already been inlined by {@link StatementBuilder}. Implementations
 * must be safe to call repeatedly and must report whether the link is alive, so callers can (re)connect lazily.
 *
 * @since 1.0.0
 */
public interface CqlConnection extends AutoCloseable {
	/**
	 * @return {@code true} if a session is open
	 */
	boolean isConnected();

	/**
	 * Opens a session if one is not already open. Calling this when already connected has no effect.
	 *
	 * @throws ConnectionException if the cluster cannot be reached
	 */
	void connect();

	/**
	 * Executes {@code cql}, connecting first if necessary.
	 *
	 * @param cql the statement text
	 * @return the returned column names and rows, or {@link ResultSet#empty()} for statements which return no rows
	 * @throws ConnectionException         if the cluster cannot be reached
	 * @throws StatementExecutionException if the cluster rejects the statement
	 */
	@NonNull
	ResultSet execute(@NonNull String cql);

	/**
	 * Closes the session, if open. The connection may be reopened with {@link #connect()}.
	 */
	@Override
	void close();
}
