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
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Describes a single column of a {@link TableSchema}.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class ColumnDescriptor {
	@NonNull
	private final String name;
	@NonNull
	private final String normalizedName;
	@NonNull
	private final LogicalType logicalType;
	@Nullable
	private final Integer scale;
	private final boolean nullable;
	@NonNull
	private final ColumnRole role;

	private ColumnDescriptor(@NonNull Builder builder) {
		requireNonNull(builder);

		this.name = builder.name;
		this.normalizedName = normalizeName(builder.name);
		this.logicalType = builder.logicalType;
		this.scale = builder.scale;
		this.nullable = builder.nullable == null ? !builder.role.isKey() : builder.nullable;
		this.role = builder.role;

		if (this.scale != null && this.scale < 0)
			throw new IllegalArgumentException(format("Column '%s' has negative scale %d", this.name, this.scale));
	}

	/**
	 * Creates a nullable, non-key column.
	 *
	 * @param name        the column name
	 * @param logicalType the column's type
	 * @return a column descriptor
	 */
	@NonNull
	public static ColumnDescriptor of(@NonNull String name,
																		@NonNull LogicalType logicalType) {
		return withName(name, logicalType).build();
	}

	/**
	 * Acquires a builder for a column with the given name and type.
	 *
	 * @param name        the column name
	 * @param logicalType the column's type
	 * @return the builder
	 */
	@NonNull
	public static Builder withName(@NonNull String name,
																 @NonNull LogicalType logicalType) {
		requireNonNull(name);
		requireNonNull(logicalType);

		return new Builder(name, logicalType);
	}

	/**
	 * Lowercases a column name using {@link Locale#ROOT}, which is how Keyspan compares names.
	 *
	 * @param name the name to normalize
	 * @return the normalized name
	 */
	@NonNull
	public static String normalizeName(@NonNull String name) {
		requireNonNull(name);
		return name.toLowerCase(Locale.ROOT);
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof ColumnDescriptor))
			return false;

		ColumnDescriptor columnDescriptor = (ColumnDescriptor) object;

		return Objects.equals(getName(), columnDescriptor.getName())
				&& Objects.equals(getLogicalType(), columnDescriptor.getLogicalType())
				&& Objects.equals(getScale(), columnDescriptor.getScale())
				&& isNullable() == columnDescriptor.isNullable()
				&& Objects.equals(getRole(), columnDescriptor.getRole());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getName(), getLogicalType(), getScale(), isNullable(), getRole());
	}

	@Override
	public String toString() {
		List<String> components = new ArrayList<>(5);

		components.add(format("name=%s", getName()));
		components.add(format("logicalType=%s", getLogicalType().name()));

		Integer scale = getScale().orElse(null);

		if (scale != null)
			components.add(format("scale=%d", scale));

		components.add(format("nullable=%s", isNullable()));
		components.add(format("role=%s", getRole().name()));

		return format("%s{%s}", getClass().getSimpleName(), components.stream().collect(Collectors.joining(", ")));
	}

	@NonNull
	public String getName() {
		return this.name;
	}

	/**
	 * @return the lowercased form of {@link #getName()}
	 */
	@NonNull
	public String getNormalizedName() {
		return this.normalizedName;
	}

	@NonNull
	public LogicalType getLogicalType() {
		return this.logicalType;
	}

	/**
	 * The declared number of fractional digits, meaningful only for {@link LogicalType#DECIMAL} columns.
	 *
	 * @return the declared scale, or empty if none was declared
	 */
	@NonNull
	public Optional<Integer> getScale() {
		return Optional.ofNullable(this.scale);
	}

	public boolean isNullable() {
		return this.nullable;
	}

	@NonNull
	public ColumnRole getRole() {
		return this.role;
	}

	/**
	 * Builder used to construct instances of {@link ColumnDescriptor}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @since 1.0.0
	 */
	@NotThreadSafe
	public static class Builder {
		@NonNull
		private final String name;
		@NonNull
		private final LogicalType logicalType;
		@Nullable
		private Integer scale;
		@Nullable
		private Boolean nullable;
		@NonNull
		private ColumnRole role;

		private Builder(@NonNull String name,
										@NonNull LogicalType logicalType) {
			requireNonNull(name);
			requireNonNull(logicalType);

			if (name.trim().length() == 0)
				throw new IllegalArgumentException("Column name must not be blank");

			this.name = name;
			this.logicalType = logicalType;
			this.role = ColumnRole.REGULAR;
		}

		@NonNull
		public Builder scale(@Nullable Integer scale) {
			this.scale = scale;
			return this;
		}

		/**
		 * Defaults to {@code true} for regular columns and {@code false} for key columns.
		 */
		@NonNull
		public Builder nullable(@Nullable Boolean nullable) {
			this.nullable = nullable;
			return this;
		}

		@NonNull
		public Builder role(@NonNull ColumnRole role) {
			requireNonNull(role);
			this.role = role;
			return this;
		}

		@NonNull
		public Builder partitionKey() {
			return role(ColumnRole.PARTITION_KEY);
		}

		@NonNull
		public Builder clusteringKey() {
			return role(ColumnRole.CLUSTERING_KEY);
		}

		@NonNull
		public ColumnDescriptor build() {
			return new ColumnDescriptor(this);
		}
	}
}
