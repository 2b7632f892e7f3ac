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
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Thrown when a scalar cannot be converted between its Java form and its CQL text form.
 *
 * @since 1.0.0
 */
@NotThreadSafe
public class TypeConversionException extends KeyspanException {
	/**
	 * Broad categories of conversion failure.
	 */
	public enum Kind {
		/**
		 * The value parsed but does not fit the column's width (for example {@code 300} for a {@code TINYINT}).
		 */
		OUT_OF_RANGE,
		/**
		 * The text could not be parsed as the column's type.
		 */
		MALFORMED,
		/**
		 * The Java value's type cannot be represented by the column's type.
		 */
		INCOMPATIBLE_TYPE
	}

	@NonNull
	private final Kind kind;
	@NonNull
	private final LogicalType logicalType;
	@Nullable
	private final Object input;

	public TypeConversionException(@NonNull Kind kind,
																 @NonNull String column,
																 @NonNull LogicalType logicalType,
																 @Nullable Object input,
																 @Nullable String message) {
		this(kind, column, logicalType, input, message, null);
	}

	public TypeConversionException(@NonNull Kind kind,
																 @NonNull String column,
																 @NonNull LogicalType logicalType,
																 @Nullable Object input,
																 @Nullable String message,
																 @Nullable Throwable cause) {
		super(message, cause, null, null, null, requireNonNull(column));
		requireNonNull(kind);
		requireNonNull(logicalType);

		this.kind = kind;
		this.logicalType = logicalType;
		this.input = input;
	}

	@NonNull
	public Kind getKind() {
		return this.kind;
	}

	@NonNull
	public LogicalType getLogicalType() {
		return this.logicalType;
	}

	/**
	 * @return the value or text which failed to convert, or empty if it was {@code null}
	 */
	@NonNull
	public Optional<Object> getInput() {
		return Optional.ofNullable(this.input);
	}
}
