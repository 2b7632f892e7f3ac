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

import com.keyspan.KeyPredicate.Term;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;
import javax.annotation.concurrent.ThreadSafe;
import java.util.List;
import java.util.stream.Collectors;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Assembles CQL statement text for a {@link TableSchema}.
 * <p>
 * Every value is encoded by the configured {@link TypeMapper} and inlined as a literal; identifiers are emitted
 * verbatim and unquoted. A value which cannot be encoded causes a {@link TypeConversionException} to be thrown.
 * <p>
 * Instances are immutable and thread-safe.
 *
 * @since 1.0.0
 */
@ThreadSafe
public class StatementBuilder {
	@NonNull
	private final TypeMapper typeMapper;
	private final boolean strictSchema;

	protected StatementBuilder(@NonNull Builder builder) {
		requireNonNull(builder);

		this.typeMapper = builder.typeMapper;
		this.strictSchema = builder.strictSchema;
	}

	/**
	 * Acquires a statement builder with out-of-the-box defaults: {@link TypeMapper#withDefaultConfiguration()} and a
	 * lenient schema policy.
	 *
	 * @return a statement builder
	 */
	@NonNull
	public static StatementBuilder withDefaultConfiguration() {
		return withTypeMapper(TypeMapper.withDefaultConfiguration()).build();
	}

	/**
	 * Acquires a builder for a statement builder which encodes values with {@code typeMapper}.
	 *
	 * @param typeMapper the type mapper to encode values with
	 * @return the builder
	 */
	@NonNull
	public static Builder withTypeMapper(@NonNull TypeMapper typeMapper) {
		requireNonNull(typeMapper);
		return new Builder(typeMapper);
	}

	/**
	 * Builds {@code CREATE KEYSPACE IF NOT EXISTS} using {@code SimpleStrategy} replication.
	 *
	 * @param keyspace          the keyspace to create
	 * @param replicationFactor the replication factor, at least {@code 1}
	 * @return the statement text
	 */
	@NonNull
	public String buildCreateKeyspace(@NonNull String keyspace,
																		int replicationFactor) {
		requireNonNull(keyspace);

		if (replicationFactor < 1)
			throw new IllegalArgumentException(format("Replication factor must be at least 1, was %d", replicationFactor));

		return format("CREATE KEYSPACE IF NOT EXISTS %s WITH replication = {'class': 'SimpleStrategy', 'replication_factor': %d}",
				keyspace, replicationFactor);
	}

	/**
	 * Builds {@code CREATE TABLE IF NOT EXISTS} with columns in schema order followed by the primary key.
	 * <p>
	 * A multi-column partition key is parenthesized, e.g. {@code PRIMARY KEY ((tenant, id), created)}.
	 *
	 * @param schema the table to create
	 * @return the statement text
	 * @throws UnsupportedFeatureException if strict schema checking is enabled and the table has a column with no
	 *                                     dedicated mapping, or a key column whose type cannot be a key
	 */
	@NonNull
	public String buildCreateTable(@NonNull TableSchema schema) {
		requireNonNull(schema);

		if (isStrictSchema())
			verifySchema(schema);

		StringBuilder cql = new StringBuilder();
		cql.append("CREATE TABLE IF NOT EXISTS ").append(schema.getQualifiedName()).append(" (");
		cql.append(schema.getColumns().stream()
				.map(column -> format("%s %s", column.getName(), getTypeMapper().cqlTypeName(column)))
				.collect(Collectors.joining(", ")));

		if (!schema.getPrimaryKeyColumns().isEmpty()) {
			List<ColumnDescriptor> partitionKeyColumns = schema.getPartitionKeyColumns();
			String partitionKey = partitionKeyColumns.stream().map(ColumnDescriptor::getName).collect(Collectors.joining(", "));

			if (partitionKeyColumns.size() > 1)
				partitionKey = format("(%s)", partitionKey);

			cql.append(", PRIMARY KEY (").append(partitionKey);

			for (ColumnDescriptor clusteringKeyColumn : schema.getClusteringKeyColumns())
				cql.append(", ").append(clusteringKeyColumn.getName());

			cql.append(")");
		}

		cql.append(")");

		return cql.toString();
	}

	@NonNull
	public String buildDropTable(@NonNull TableSchema schema) {
		requireNonNull(schema);
		return format("DROP TABLE IF EXISTS %s", schema.getQualifiedName());
	}

	@NonNull
	public String buildTruncate(@NonNull TableSchema schema) {
		requireNonNull(schema);
		return format("TRUNCATE %s", schema.getQualifiedName());
	}

	/**
	 * Builds an {@code INSERT} of every schema column, in schema order. Columns absent from {@code row} are written as
	 * {@code NULL}.
	 *
	 * @param schema the target table
	 * @param row    the values to insert
	 * @return the statement text
	 */
	@NonNull
	public String buildInsert(@NonNull TableSchema schema,
														@NonNull Row row) {
		requireNonNull(schema);
		requireNonNull(row);

		verifyColumnNames(schema, row);

		String columnList = schema.getColumns().stream()
				.map(ColumnDescriptor::getName)
				.collect(Collectors.joining(", "));
		String valueList = schema.getColumns().stream()
				.map(column -> encode(row.get(column.getName()).orElse(null), column))
				.collect(Collectors.joining(", "));

		return format("INSERT INTO %s (%s) VALUES (%s)", schema.getQualifiedName(), columnList, valueList);
	}

	/**
	 * Builds an {@code UPDATE} which sets every non-key column from {@code newRow}, identifying the record by the key
	 * values in {@code oldRow}. Key columns never appear in the {@code SET} clause.
	 *
	 * @param schema the target table
	 * @param oldRow the record as it was, used for the {@code WHERE} clause
	 * @param newRow the record as it should be
	 * @return the statement text
	 * @throws UnsupportedFeatureException if every column of the table is part of the primary key
	 */
	@NonNull
	public String buildUpdate(@NonNull TableSchema schema,
														@NonNull Row oldRow,
														@NonNull Row newRow) {
		requireNonNull(schema);
		requireNonNull(oldRow);
		requireNonNull(newRow);

		verifyColumnNames(schema, newRow);

		List<ColumnDescriptor> regularColumns = schema.getRegularColumns();

		if (regularColumns.isEmpty())
			throw new UnsupportedFeatureException(format("Table %s has no non-key columns to update", schema.getQualifiedName()),
					schema.getKeyspace(), schema.getTable(), null);

		String setClause = regularColumns.stream()
				.map(column -> format("%s = %s", column.getName(), encode(newRow.get(column.getName()).orElse(null), column)))
				.collect(Collectors.joining(", "));

		return format("UPDATE %s SET %s WHERE %s", schema.getQualifiedName(), setClause,
				buildWhere(KeyPredicate.fromRow(schema, oldRow)));
	}

	@NonNull
	public String buildDelete(@NonNull TableSchema schema,
														@NonNull Row row) {
		requireNonNull(schema);
		requireNonNull(row);

		return format("DELETE FROM %s WHERE %s", schema.getQualifiedName(), buildWhere(KeyPredicate.fromRow(schema, row)));
	}

	/**
	 * Builds a {@code SELECT} of every schema column.
	 * <p>
	 * The {@code WHERE} keyword is omitted when {@code whereClause} is {@code null}, empty or only whitespace.
	 *
	 * @param schema         the source table
	 * @param whereClause    the predicate, without the {@code WHERE} keyword
	 * @param allowFiltering whether to append {@code ALLOW FILTERING}
	 * @return the statement text
	 */
	@NonNull
	public String buildSelect(@NonNull TableSchema schema,
														@Nullable String whereClause,
														boolean allowFiltering) {
		requireNonNull(schema);

		StringBuilder cql = new StringBuilder();
		cql.append("SELECT ")
				.append(schema.getColumns().stream().map(ColumnDescriptor::getName).collect(Collectors.joining(", ")))
				.append(" FROM ")
				.append(schema.getQualifiedName());

		if (whereClause != null && !whereClause.isBlank())
			cql.append(" WHERE ").append(whereClause);

		if (allowFiltering)
			cql.append(" ALLOW FILTERING");

		return cql.toString();
	}

	@NonNull
	public String buildSelect(@NonNull TableSchema schema,
														@NonNull KeyPredicate keyPredicate,
														boolean allowFiltering) {
		requireNonNull(keyPredicate);
		return buildSelect(schema, buildWhere(keyPredicate), allowFiltering);
	}

	/**
	 * Conjoins the predicate's terms as {@code column = value AND ...}. An empty predicate yields the empty string.
	 *
	 * @param keyPredicate the predicate to render
	 * @return the {@code WHERE} clause body
	 */
	@NonNull
	public String buildWhere(@NonNull KeyPredicate keyPredicate) {
		requireNonNull(keyPredicate);

		return keyPredicate.getTerms().stream()
				.map(this::formatTerm)
				.collect(Collectors.joining(" AND "));
	}

	@NonNull
	public String buildWhereFromKey(@NonNull TableSchema schema,
																	@NonNull List<?> keyParts) {
		return buildWhere(KeyPredicate.fromKeyParts(schema, keyParts));
	}

	/**
	 * Renders a {@code WHERE} clause body for a prefix of the primary key, stopping at the first key part whose bit is
	 * clear in {@code keyPartMap}.
	 *
	 * @param schema     the table
	 * @param keyParts   values for the leading key columns
	 * @param keyPartMap bitmap of which key parts are present, bit {@code 0} being the first
	 * @return the {@code WHERE} clause body
	 */
	@NonNull
	public String buildWhereFromKey(@NonNull TableSchema schema,
																	@NonNull List<?> keyParts,
																	long keyPartMap) {
		return buildWhere(KeyPredicate.fromKeyParts(schema, keyParts, keyPartMap));
	}

	@NonNull
	protected String formatTerm(@NonNull Term term) {
		requireNonNull(term);
		return format("%s = %s", term.column().getName(), encode(term.value(), term.column()));
	}

	@NonNull
	protected String encode(@Nullable Object value,
													@NonNull ColumnDescriptor column) {
		requireNonNull(column);
		return requireNonNull(getTypeMapper().encode(value, column).orElseThrow());
	}

	protected void verifySchema(@NonNull TableSchema schema) {
		requireNonNull(schema);

		for (ColumnDescriptor column : schema.getColumns()) {
			if (!column.getLogicalType().isSupported())
				throw new UnsupportedFeatureException(format("Column '%s' has no dedicated CQL mapping", column.getName()),
						schema.getKeyspace(), schema.getTable(), column.getName());

			if (schema.isPrimaryKeyColumn(column) && !column.getLogicalType().canBePrimaryKey())
				throw new UnsupportedFeatureException(format("Column '%s' of type %s cannot be part of a primary key",
						column.getName(), column.getLogicalType().name()), schema.getKeyspace(), schema.getTable(), column.getName());
		}
	}

	protected void verifyColumnNames(@NonNull TableSchema schema,
																	 @NonNull Row row) {
		requireNonNull(schema);
		requireNonNull(row);

		for (String columnName : row.getColumnNames())
			if (schema.getColumn(columnName).isEmpty())
				throw new IllegalArgumentException(format("Table %s has no column named '%s'", schema.getQualifiedName(), columnName));
	}

	@NonNull
	public TypeMapper getTypeMapper() {
		return this.typeMapper;
	}

	public boolean isStrictSchema() {
		return this.strictSchema;
	}

	/**
	 * Builder used to construct instances of {@link StatementBuilder}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @since 1.0.0
	 */
	@NotThreadSafe
	public static class Builder {
		@NonNull
		private final TypeMapper typeMapper;
		private boolean strictSchema;

		private Builder(@NonNull TypeMapper typeMapper) {
			requireNonNull(typeMapper);
			this.typeMapper = typeMapper;
		}

		/**
		 * Rejects, at {@code CREATE TABLE} time, columns with no dedicated mapping and key columns whose type cannot be
		 * a key. Off by default, in which case such columns travel as text.
		 *
		 * @param strictSchema whether to reject unsupported schemas
		 * @return this {@code Builder}, for chaining
		 */
		@NonNull
		public Builder strictSchema(boolean strictSchema) {
			this.strictSchema = strictSchema;
			return this;
		}

		@NonNull
		public StatementBuilder build() {
			return new StatementBuilder(this);
		}
	}
}
