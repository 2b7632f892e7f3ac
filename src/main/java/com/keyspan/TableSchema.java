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

import javax.annotation.concurrent.NotThreadSafe;
import javax.annotation.concurrent.ThreadSafe;
import java.util.ArrayList;
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
 * The ordered set of columns of a CQL table, plus the keyspace and table it lives in.
 * <p>
 * Column order is significant: it is the order of {@code CREATE TABLE}, {@code INSERT} and {@code SELECT} column
 * lists. Column names are compared case-insensitively.
 * <p>
 * The primary key is every partition-key column followed by every clustering-key column, each in schema order. If no
 * column is marked as a key, the first column is used.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class TableSchema {
	@NonNull
	private final String keyspace;
	@NonNull
	private final String table;
	@NonNull
	private final List<ColumnDescriptor> columns;
	@NonNull
	private final Map<String, ColumnDescriptor> columnsByNormalizedName;
	@NonNull
	private final List<ColumnDescriptor> partitionKeyColumns;
	@NonNull
	private final List<ColumnDescriptor> clusteringKeyColumns;

	private TableSchema(@NonNull Builder builder) {
		requireNonNull(builder);

		this.keyspace = builder.keyspace;
		this.table = builder.table;
		this.columns = Collections.unmodifiableList(new ArrayList<>(builder.columns));

		Map<String, ColumnDescriptor> columnsByNormalizedName = new LinkedHashMap<>(this.columns.size());

		for (ColumnDescriptor column : this.columns)
			if (columnsByNormalizedName.put(column.getNormalizedName(), column) != null)
				throw new IllegalArgumentException(format("Duplicate column name '%s' in table %s.%s",
						column.getName(), this.keyspace, this.table));

		this.columnsByNormalizedName = Collections.unmodifiableMap(columnsByNormalizedName);

		List<ColumnDescriptor> partitionKeyColumns = this.columns.stream()
				.filter(column -> column.getRole() == ColumnRole.PARTITION_KEY)
				.collect(Collectors.toList());
		List<ColumnDescriptor> clusteringKeyColumns = this.columns.stream()
				.filter(column -> column.getRole() == ColumnRole.CLUSTERING_KEY)
				.collect(Collectors.toList());

		if (partitionKeyColumns.isEmpty() && clusteringKeyColumns.isEmpty() && !this.columns.isEmpty())
			partitionKeyColumns = List.of(this.columns.get(0));
		else if (partitionKeyColumns.isEmpty() && !clusteringKeyColumns.isEmpty())
			throw new IllegalArgumentException(format("Table %s.%s has clustering columns but no partition key",
					this.keyspace, this.table));

		this.partitionKeyColumns = Collections.unmodifiableList(partitionKeyColumns);
		this.clusteringKeyColumns = Collections.unmodifiableList(clusteringKeyColumns);
	}

	/**
	 * Acquires a builder for a table in the given keyspace.
	 *
	 * @param keyspace the keyspace name
	 * @param table    the table name
	 * @return the builder
	 */
	@NonNull
	public static Builder with(@NonNull String keyspace,
														 @NonNull String table) {
		requireNonNull(keyspace);
		requireNonNull(table);

		return new Builder(keyspace, table);
	}

	@NonNull
	public static TableSchema of(@NonNull String keyspace,
															 @NonNull String table,
															 @NonNull List<ColumnDescriptor> columns) {
		requireNonNull(columns);
		return with(keyspace, table).columns(columns).build();
	}

	/**
	 * Copies this schema under a different keyspace and table name, keeping its columns and keys.
	 *
	 * @param keyspace the keyspace name
	 * @param table    the table name
	 * @return the renamed schema, or this schema if both names are unchanged
	 */
	@NonNull
	public TableSchema withQualifiedName(@NonNull String keyspace,
																			 @NonNull String table) {
		requireNonNull(keyspace);
		requireNonNull(table);

		if (keyspace.equals(getKeyspace()) && table.equals(getTable()))
			return this;

		return of(keyspace, table, getColumns());
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof TableSchema))
			return false;

		TableSchema tableSchema = (TableSchema) object;

		return Objects.equals(getKeyspace(), tableSchema.getKeyspace())
				&& Objects.equals(getTable(), tableSchema.getTable())
				&& Objects.equals(getColumns(), tableSchema.getColumns());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getKeyspace(), getTable(), getColumns());
	}

	@Override
	public String toString() {
		return format("%s{qualifiedName=%s, columns=%s}", getClass().getSimpleName(), getQualifiedName(),
				getColumns().stream().map(ColumnDescriptor::getName).collect(Collectors.joining(", ")));
	}

	@NonNull
	public String getKeyspace() {
		return this.keyspace;
	}

	@NonNull
	public String getTable() {
		return this.table;
	}

	/**
	 * @return {@code keyspace.table}, as it appears in statements
	 */
	@NonNull
	public String getQualifiedName() {
		return format("%s.%s", getKeyspace(), getTable());
	}

	@NonNull
	public List<ColumnDescriptor> getColumns() {
		return this.columns;
	}

	/**
	 * Looks up a column by name, ignoring case.
	 *
	 * @param name the column name
	 * @return the column, or empty if this table has no such column
	 */
	@NonNull
	public Optional<ColumnDescriptor> getColumn(@NonNull String name) {
		requireNonNull(name);
		return Optional.ofNullable(this.columnsByNormalizedName.get(ColumnDescriptor.normalizeName(name)));
	}

	@NonNull
	public List<ColumnDescriptor> getPartitionKeyColumns() {
		return this.partitionKeyColumns;
	}

	@NonNull
	public List<ColumnDescriptor> getClusteringKeyColumns() {
		return this.clusteringKeyColumns;
	}

	/**
	 * @return partition-key columns followed by clustering-key columns; empty only for a table with no columns
	 */
	@NonNull
	public List<ColumnDescriptor> getPrimaryKeyColumns() {
		List<ColumnDescriptor> primaryKeyColumns = new ArrayList<>(getPartitionKeyColumns().size() + getClusteringKeyColumns().size());
		primaryKeyColumns.addAll(getPartitionKeyColumns());
		primaryKeyColumns.addAll(getClusteringKeyColumns());
		return Collections.unmodifiableList(primaryKeyColumns);
	}

	public boolean isPrimaryKeyColumn(@NonNull ColumnDescriptor column) {
		requireNonNull(column);
		return getPartitionKeyColumns().contains(column) || getClusteringKeyColumns().contains(column);
	}

	/**
	 * @return every column which is not part of the primary key, in schema order
	 */
	@NonNull
	public List<ColumnDescriptor> getRegularColumns() {
		return getColumns().stream()
				.filter(column -> !isPrimaryKeyColumn(column))
				.collect(Collectors.toUnmodifiableList());
	}

	/**
	 * Builder used to construct instances of {@link TableSchema}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @since 1.0.0
	 */
	@NotThreadSafe
	public static class Builder {
		@NonNull
		private final String keyspace;
		@NonNull
		private final String table;
		@NonNull
		private final List<ColumnDescriptor> columns;

		private Builder(@NonNull String keyspace,
										@NonNull String table) {
			requireNonNull(keyspace);
			requireNonNull(table);

			this.keyspace = keyspace;
			this.table = table;
			this.columns = new ArrayList<>();
		}

		@NonNull
		public Builder column(@NonNull ColumnDescriptor column) {
			requireNonNull(column);
			this.columns.add(column);
			return this;
		}

		@NonNull
		public Builder column(@NonNull String name,
													@NonNull LogicalType logicalType) {
			return column(ColumnDescriptor.of(name, logicalType));
		}

		@NonNull
		public Builder columns(@NonNull List<ColumnDescriptor> columns) {
			requireNonNull(columns);
			columns.forEach(this::column);
			return this;
		}

		@NonNull
		public TableSchema build() {
			return new TableSchema(this);
		}
	}
}
