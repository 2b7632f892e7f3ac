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
import javax.annotation.concurrent.NotThreadSafe;
import java.util.List;
import java.util.Locale;

import static java.util.Objects.requireNonNull;

/**
 * Contract for decoding one textual result row into a {@link Row} shaped by a {@link TableSchema}.
 * <p>
 * Cells are matched to schema columns by name, ignoring case, never by position.
 * <p>
 * A production-ready concrete implementation is available via the following static methods:
 * <ul>
 *   <li>{@link #withDefaultConfiguration()}</li>
 *   <li>{@link #withTypeMapper(TypeMapper)} (builder)</li>
 *   <li>{@link #withNormalizationLocale(Locale)} (builder)</li>
 * </ul>
 * <p>
 * How to acquire an instance:
 * <pre>{@code  // With out-of-the-box defaults
 * ResultMaterializer default = ResultMaterializer.withDefaultConfiguration();
 *
 * // Customized
 * ResultMaterializer custom = ResultMaterializer.withTypeMapper(TypeMapper.withTimeZone(zoneId))
 *  .normalizationLocale(Locale.forLanguageTag("tr-TR"))
 *  .build();}</pre>
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface ResultMaterializer {
	/**
	 * Decodes {@code row} into a {@link Row} holding every column of {@code schema}.
	 * <p>
	 * Schema columns missing from {@code columnNames} are {@code null} in the result. Cells which fail to decode are
	 * {@code null} in the result and reported by {@link Materialization#getFailures()}.
	 *
	 * @param columnNames the column names the cluster returned
	 * @param row         one row of cells aligned with {@code columnNames}
	 * @param schema      the table being read
	 * @return the decoded row and any per-cell failures
	 * @throws KeyspanException if two returned column names are equal ignoring case
	 */
	@Nonnull
	Materialization materialize(@Nonnull List<String> columnNames,
															@Nonnull ResultRow row,
															@Nonnull TableSchema schema);

	/**
	 * Acquires a concrete implementation of this interface with out-of-the-box defaults.
	 * <p>
	 * The returned instance is thread-safe.
	 *
	 * @return a concrete implementation of this interface with out-of-the-box defaults
	 */
	@Nonnull
	static ResultMaterializer withDefaultConfiguration() {
		return new Builder().build();
	}

	/**
	 * Acquires a builder for a concrete implementation of this interface, specifying the type mapper used to decode
	 * cells.
	 *
	 * @param typeMapper the type mapper used to decode cells
	 * @return a {@code Builder} for a concrete implementation
	 */
	@Nonnull
	static Builder withTypeMapper(@Nonnull TypeMapper typeMapper) {
		requireNonNull(typeMapper);
		return new Builder().typeMapper(typeMapper);
	}

	/**
	 * Acquires a builder for a concrete implementation of this interface, specifying the locale to use when lowercasing
	 * column names for matching.
	 *
	 * @param normalizationLocale the locale to use when lowercasing column names
	 * @return a {@code Builder} for a concrete implementation
	 */
	@Nonnull
	static Builder withNormalizationLocale(@Nonnull Locale normalizationLocale) {
		requireNonNull(normalizationLocale);
		return new Builder().normalizationLocale(normalizationLocale);
	}

	/**
	 * Builder used to construct a standard implementation of {@link ResultMaterializer}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @since 1.0.0
	 */
	@NotThreadSafe
	class Builder {
		@Nonnull
		TypeMapper typeMapper;
		@Nonnull
		Locale normalizationLocale;

		private Builder() {
			this.typeMapper = TypeMapper.withDefaultConfiguration();
			this.normalizationLocale = Locale.ROOT;
		}

		@Nonnull
		public Builder typeMapper(@Nonnull TypeMapper typeMapper) {
			requireNonNull(typeMapper);
			this.typeMapper = typeMapper;
			return this;
		}

		/**
		 * Specifies the locale to use when lowercasing column names for matching.
		 *
		 * @param normalizationLocale the locale to use when lowercasing column names
		 * @return this {@code Builder}, for chaining
		 */
		@Nonnull
		public Builder normalizationLocale(@Nonnull Locale normalizationLocale) {
			requireNonNull(normalizationLocale);
			this.normalizationLocale = normalizationLocale;
			return this;
		}

		@Nonnull
		public ResultMaterializer build() {
			return new DefaultResultMaterializer(this);
		}
	}
}
