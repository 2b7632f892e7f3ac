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

import java.time.ZoneId;
import java.util.Locale;

import static java.util.Objects.requireNonNull;

/**
 * Contract for converting single values between their Java form and their CQL text form.
 * <p>
 * Encoding produces a CQL literal ready to be inlined into a statement: strings are quoted and escaped, numbers are
 * bare, and {@code null} is the unquoted literal {@code NULL}. Decoding accepts the text a {@link CqlConnection}
 * returns for a cell.
 * <p>
 * Neither direction throws for bad input. Problems are reported as a failed {@link ConversionResult}.
 * <p>
 * How to acquire an instance:
 * <pre>{@code  // With out-of-the-box defaults (timestamps in UTC)
 * TypeMapper typeMapper = TypeMapper.withDefaultConfiguration();
 *
 * // Interpreting timestamps in a specific zone
 * TypeMapper typeMapper = TypeMapper.withTimeZone(ZoneId.of("America/New_York"));}</pre>
 *
 * @since 1.0.0
 */
public interface TypeMapper {
	/**
	 * Encodes {@code value} as a CQL literal for {@code column}.
	 *
	 * @param value  the value to encode, may be {@code null}
	 * @param column the destination column
	 * @return the CQL literal, or a failure
	 */
	@NonNull
	ConversionResult<String> encode(@Nullable Object value,
																	@NonNull ColumnDescriptor column);

	/**
	 * Decodes the textual cell {@code text} into the Java type associated with {@code column}'s logical type.
	 * <p>
	 * {@code null}, {@code "NULL"} and {@code ""} all decode to {@code null}.
	 *
	 * @param text   the cell text, may be {@code null}
	 * @param column the source column
	 * @return the decoded value, or a failure
	 */
	@NonNull
	ConversionResult<Object> decode(@Nullable String text,
																	@NonNull ColumnDescriptor column);

	/**
	 * @param column the column
	 * @return the CQL type used to store {@code column}, e.g. {@code bigint}
	 */
	@NonNull
	default String cqlTypeName(@NonNull ColumnDescriptor column) {
		requireNonNull(column);
		return cqlTypeName(column.getLogicalType());
	}

	@NonNull
	default String cqlTypeName(@NonNull LogicalType logicalType) {
		requireNonNull(logicalType);
		return logicalType.getCqlTypeName();
	}

	/**
	 * Encodes {@code value} for an anonymous column of the given type.
	 *
	 * @param value       the value to encode, may be {@code null}
	 * @param logicalType the destination type
	 * @return the CQL literal, or a failure
	 */
	@NonNull
	default ConversionResult<String> encode(@Nullable Object value,
																					@NonNull LogicalType logicalType) {
		requireNonNull(logicalType);
		return encode(value, ColumnDescriptor.of(logicalType.name().toLowerCase(Locale.ROOT), logicalType));
	}

	/**
	 * Decodes {@code text} for an anonymous column of the given type.
	 *
	 * @param text        the cell text, may be {@code null}
	 * @param logicalType the source type
	 * @return the decoded value, or a failure
	 */
	@NonNull
	default ConversionResult<Object> decode(@Nullable String text,
																					@NonNull LogicalType logicalType) {
		requireNonNull(logicalType);
		return decode(text, ColumnDescriptor.of(logicalType.name().toLowerCase(Locale.ROOT), logicalType));
	}

	/**
	 * Acquires a concrete implementation of this interface with out-of-the-box defaults.
	 * <p>
	 * Timestamps are interpreted in UTC. The returned instance is thread-safe.
	 *
	 * @return a concrete implementation of this interface with out-of-the-box defaults
	 */
	@NonNull
	static TypeMapper withDefaultConfiguration() {
		return new DefaultTypeMapper(ZoneId.of("UTC"));
	}

	/**
	 * Acquires a concrete implementation of this interface which interprets calendar timestamps in {@code timeZone}.
	 * <p>
	 * The returned instance is thread-safe.
	 *
	 * @param timeZone the zone used to convert between calendar fields and epoch milliseconds
	 * @return a concrete implementation of this interface
	 */
	@NonNull
	static TypeMapper withTimeZone(@NonNull ZoneId timeZone) {
		requireNonNull(timeZone);
		return new DefaultTypeMapper(timeZone);
	}
}
