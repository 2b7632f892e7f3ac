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

import javax.annotation.concurrent.ThreadSafe;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * An ordered conjunction of {@code column = value} equality terms over primary-key columns.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class KeyPredicate {
	@NonNull
	private static final KeyPredicate EMPTY = new KeyPredicate(List.of());

	@NonNull
	private final List<Term> terms;

	private KeyPredicate(@NonNull List<Term> terms) {
		requireNonNull(terms);
		this.terms = Collections.unmodifiableList(new ArrayList<>(terms));
	}

	@NonNull
	public static KeyPredicate empty() {
		return EMPTY;
	}

	@NonNull
	public static KeyPredicate of(@NonNull List<Term> terms) {
		requireNonNull(terms);
		return terms.isEmpty() ? EMPTY : new KeyPredicate(terms);
	}

	/**
	 * Extracts every primary-key column's value from {@code row}. Absent key columns are treated as {@code null}.
	 *
	 * @param schema the table schema
	 * @param row    the row identifying a record
	 * @return the key predicate
	 */
	@NonNull
	public static KeyPredicate fromRow(@NonNull TableSchema schema,
																		 @NonNull Row row) {
		requireNonNull(schema);
		requireNonNull(row);

		return of(schema.getPrimaryKeyColumns().stream()
				.map(column -> new Term(column, row.get(column.getName()).orElse(null)))
				.collect(Collectors.toList()));
	}

	/**
	 * Pairs the leading primary-key columns with the supplied key parts, in order.
	 *
	 * @param schema   the table schema
	 * @param keyParts values for a prefix of the primary key
	 * @return the key predicate
	 * @throws IllegalArgumentException if more key parts are supplied than the table has key columns
	 */
	@NonNull
	public static KeyPredicate fromKeyParts(@NonNull TableSchema schema,
																					@NonNull List<?> keyParts) {
		requireNonNull(keyParts);
		return fromKeyParts(schema, keyParts, -1L);
	}

	/**
	 * Pairs the leading primary-key columns with the supplied key parts, in order, stopping at the first part whose bit
	 * in {@code keyPartMap} is clear. Bit {@code 0} corresponds to the first key column.
	 *
	 * @param schema     the table schema
	 * @param keyParts   values for a prefix of the primary key
	 * @param keyPartMap bitmap of which key parts are present
	 * @return the key predicate
	 * @throws IllegalArgumentException if more key parts are supplied than the table has key columns
	 */
	@NonNull
	public static KeyPredicate fromKeyParts(@NonNull TableSchema schema,
																					@NonNull List<?> keyParts,
																					long keyPartMap) {
		requireNonNull(schema);
		requireNonNull(keyParts);

		List<ColumnDescriptor> keyColumns = schema.getPrimaryKeyColumns();

		if (keyParts.size() > keyColumns.size())
			throw new IllegalArgumentException(format("Table %s has %d key column[s] but %d key part[s] were supplied",
					schema.getQualifiedName(), keyColumns.size(), keyParts.size()));

		List<Term> terms = new ArrayList<>(keyParts.size());

		for (int i = 0; i < keyParts.size() && i < Long.SIZE; ++i) {
			if ((keyPartMap & (1L << i)) == 0)
				break;

			terms.add(new Term(keyColumns.get(i), keyParts.get(i)));
		}

		return of(terms);
	}

	@NonNull
	public List<Term> getTerms() {
		return this.terms;
	}

	public boolean isEmpty() {
		return this.terms.isEmpty();
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof KeyPredicate))
			return false;

		KeyPredicate keyPredicate = (KeyPredicate) object;
		return Objects.equals(getTerms(), keyPredicate.getTerms());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getTerms());
	}

	@Override
	public String toString() {
		return format("%s{%s}", getClass().getSimpleName(), getTerms().stream()
				.map(term -> format("%s=%s", term.column().getName(), term.value()))
				.collect(Collectors.joining(", ")));
	}

	/**
	 * A single {@code column = value} equality.
	 *
	 * @param column the key column
	 * @param value  the value to match, possibly {@code null}
	 */
	public record Term(@NonNull ColumnDescriptor column, @Nullable Object value) {
		public Term {
			requireNonNull(column);
		}
	}
}
