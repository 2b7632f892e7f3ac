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
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;
import javax.annotation.concurrent.ThreadSafe;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * An immutable, ordered mapping of column names to values.
 * <p>
 * A column may be absent, present with an explicit {@code null}, or present with a value; {@link #contains(String)},
 * {@link #isNull(String)} and {@link #get(String)} tell them apart. Names are matched case-insensitively.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class Row {
	@NonNull
	private static final Row EMPTY = new Row(new LinkedHashMap<>());

	// Keyed by normalized name
	@NonNull
	private final Map<String, Cell> cells;

	private Row(@NonNull Map<String, Cell> cells) {
		requireNonNull(cells);
		this.cells = Collections.unmodifiableMap(new LinkedHashMap<>(cells));
	}

	@NonNull
	public static Row empty() {
		return EMPTY;
	}

	@NonNull
	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Creates a row from the given map, preserving its iteration order. {@code null} map values are explicit nulls.
	 *
	 * @param values column names to values
	 * @return a row
	 */
	@NonNull
	public static Row of(@NonNull Map<String, ?> values) {
		requireNonNull(values);

		Builder builder = builder();
		values.forEach(builder::value);
		return builder.build();
	}

	/**
	 * @param columnName the column name
	 * @return {@code true} if the column is present, even with a {@code null} value
	 */
	public boolean contains(@NonNull String columnName) {
		requireNonNull(columnName);
		return this.cells.containsKey(ColumnDescriptor.normalizeName(columnName));
	}

	/**
	 * @param columnName the column name
	 * @return {@code true} if the column is present with an explicit {@code null} value
	 */
	public boolean isNull(@NonNull String columnName) {
		requireNonNull(columnName);
		Cell cell = this.cells.get(ColumnDescriptor.normalizeName(columnName));
		return cell != null && cell.value() == null;
	}

	/**
	 * @param columnName the column name
	 * @return the column's value, or empty if the column is absent or {@code null}
	 */
	@NonNull
	public Optional<Object> get(@NonNull String columnName) {
		requireNonNull(columnName);
		Cell cell = this.cells.get(ColumnDescriptor.normalizeName(columnName));
		return cell == null ? Optional.empty() : Optional.ofNullable(copyOf(cell.value()));
	}

	/**
	 * Typed variant of {@link #get(String)}.
	 *
	 * @param columnName the column name
	 * @param type       the expected value type
	 * @param <T>        the expected value type
	 * @return the column's value, or empty if the column is absent or {@code null}
	 * @throws ClassCastException if the value is not a {@code type}
	 */
	@NonNull
	public <T> Optional<T> get(@NonNull String columnName,
														 @NonNull Class<T> type) {
		requireNonNull(type);
		return get(columnName).map(type::cast);
	}

	/**
	 * @return column names as they were supplied, in insertion order
	 */
	@NonNull
	public List<String> getColumnNames() {
		return this.cells.values().stream().map(Cell::name).collect(Collectors.toUnmodifiableList());
	}

	public int size() {
		return this.cells.size();
	}

	public boolean isEmpty() {
		return this.cells.isEmpty();
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof Row))
			return false;

		Row row = (Row) object;

		if (!this.cells.keySet().equals(row.cells.keySet()))
			return false;

		for (Map.Entry<String, Cell> entry : this.cells.entrySet())
			if (!valuesEqual(entry.getValue().value(), row.cells.get(entry.getKey()).value()))
				return false;

		return true;
	}

	@Override
	public int hashCode() {
		int hashCode = 1;

		for (Map.Entry<String, Cell> entry : this.cells.entrySet()) {
			Object value = entry.getValue().value();
			hashCode = 31 * hashCode + Objects.hash(entry.getKey(), value instanceof byte[] ? Arrays.hashCode((byte[]) value) : value);
		}

		return hashCode;
	}

	@Override
	public String toString() {
		return format("%s{%s}", getClass().getSimpleName(), this.cells.values().stream()
				.map(cell -> format("%s=%s", cell.name(), cell.value() instanceof byte[]
						? format("[byte array of length %d]", ((byte[]) cell.value()).length)
						: cell.value()))
				.collect(Collectors.joining(", ")));
	}

	private static boolean valuesEqual(@Nullable Object value,
																		 @Nullable Object otherValue) {
		if (value instanceof byte[] && otherValue instanceof byte[])
			return Arrays.equals((byte[]) value, (byte[]) otherValue);

		return Objects.equals(value, otherValue);
	}

	// Blobs are the only mutable values a row holds
	@Nullable
	private static Object copyOf(@Nullable Object value) {
		if (value instanceof byte[] bytes)
			return bytes.clone();

		return value;
	}

	private record Cell(@NonNull String name, @Nullable Object value) {}

	/**
	 * Builder used to construct instances of {@link Row}.
	 * <p>
	 * Setting the same column twice (ignoring case) replaces the earlier value.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @since 1.0.0
	 */
	@NotThreadSafe
	public static class Builder {
		@NonNull
		private final Map<String, Cell> cells;

		private Builder() {
			this.cells = new LinkedHashMap<>();
		}

		@NonNull
		public Builder value(@NonNull String columnName,
												 @Nullable Object value) {
			requireNonNull(columnName);
			this.cells.put(ColumnDescriptor.normalizeName(columnName), new Cell(columnName, copyOf(value)));
			return this;
		}

		@NonNull
		public Builder nullValue(@NonNull String columnName) {
			return value(columnName, null);
		}

		@NonNull
		public Row build() {
			return new Row(this.cells);
		}
	}
}
