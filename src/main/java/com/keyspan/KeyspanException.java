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

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.concurrent.NotThreadSafe;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import static java.lang.String.format;

/**
 * Thrown when an error occurs while translating rows to or from CQL, or while talking to the cluster.
 * <p>
 * Specific failure kinds are modeled as subclasses: {@link ConnectionException}, {@link StatementExecutionException},
 * {@link TypeConversionException} and {@link UnsupportedFeatureException}.
 *
 * @since 1.0.0
 */
@NotThreadSafe
public class KeyspanException extends RuntimeException {
	@Nullable
	private final String cql;
	@Nullable
	private final String keyspace;
	@Nullable
	private final String table;
	@Nullable
	private final String column;

	/**
	 * Creates a {@code KeyspanException} with the given {@code message}.
	 *
	 * @param message a message describing this exception
	 */
	public KeyspanException(@Nullable String message) {
		this(message, null);
	}

	/**
	 * Creates a {@code KeyspanException} which wraps the given {@code cause}.
	 *
	 * @param cause the cause of this exception
	 */
	public KeyspanException(@Nullable Throwable cause) {
		this(cause == null ? null : cause.getMessage(), cause);
	}

	/**
	 * Creates a {@code KeyspanException} which wraps the given {@code cause}.
	 *
	 * @param message a message describing this exception
	 * @param cause   the cause of this exception
	 */
	public KeyspanException(@Nullable String message,
													@Nullable Throwable cause) {
		this(message, cause, null, null, null, null);
	}

	/**
	 * Creates a {@code KeyspanException} carrying diagnostic context.
	 *
	 * @param message  a message describing this exception
	 * @param cause    the cause of this exception
	 * @param cql      the statement text being executed, if any
	 * @param keyspace the keyspace involved, if any
	 * @param table    the table involved, if any
	 * @param column   the column involved, if any
	 */
	protected KeyspanException(@Nullable String message,
														 @Nullable Throwable cause,
														 @Nullable String cql,
														 @Nullable String keyspace,
														 @Nullable String table,
														 @Nullable String column) {
		super(message, cause);
		this.cql = cql;
		this.keyspace = keyspace;
		this.table = table;
		this.column = column;
	}

	@Override
	public String toString() {
		List<String> components = new ArrayList<>(5);

		if (getMessage() != null && getMessage().trim().length() > 0)
			components.add(format("message=%s", getMessage()));

		if (getCql().isPresent())
			components.add(format("cql=%s", getCql().get()));
		if (getKeyspace().isPresent())
			components.add(format("keyspace=%s", getKeyspace().get()));
		if (getTable().isPresent())
			components.add(format("table=%s", getTable().get()));
		if (getColumn().isPresent())
			components.add(format("column=%s", getColumn().get()));

		return format("%s: %s", getClass().getName(), components.stream().collect(Collectors.joining(", ")));
	}

	/**
	 * @return the statement text that was being executed, or empty if not available
	 */
	@Nonnull
	public Optional<String> getCql() {
		return Optional.ofNullable(this.cql);
	}

	/**
	 * @return the keyspace involved, or empty if not available
	 */
	@Nonnull
	public Optional<String> getKeyspace() {
		return Optional.ofNullable(this.keyspace);
	}

	/**
	 * @return the table involved, or empty if not available
	 */
	@Nonnull
	public Optional<String> getTable() {
		return Optional.ofNullable(this.table);
	}

	/**
	 * @return the offending column, or empty if not available
	 */
	@Nonnull
	public Optional<String> getColumn() {
		return Optional.ofNullable(this.column);
	}
}
