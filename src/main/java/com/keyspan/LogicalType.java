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

import static java.util.Objects.requireNonNull;

/**
 * Host-side column types which Keyspan knows how to carry to and from CQL.
 * <p>
 * Each type knows the CQL type it is stored as, whether it has a dedicated mapping, and whether it may participate in a
 * primary key.
 *
 * @since 1.0.0
 */
public enum LogicalType {
	TINYINT("tinyint"),
	SMALLINT("smallint"),
	INT("int"),
	BIGINT("bigint"),
	FLOAT("float"),
	DOUBLE("double"),
	DECIMAL("decimal"),
	BLOB("blob", true, false),
	TEXT("text"),
	ENUM("text"),
	SET("text"),
	JSON("text"),
	DATE("date"),
	TIME("time"),
	TIMESTAMP("timestamp"),
	BOOLEAN("boolean"),
	/**
	 * A host type with no dedicated mapping. Values travel as text.
	 */
	OTHER("text", false, true);

	@NonNull
	private final String cqlTypeName;
	private final boolean supported;
	private final boolean keyEligible;

	LogicalType(@NonNull String cqlTypeName) {
		this(cqlTypeName, true, true);
	}

	LogicalType(@NonNull String cqlTypeName,
							boolean supported,
							boolean keyEligible) {
		requireNonNull(cqlTypeName);

		this.cqlTypeName = cqlTypeName;
		this.supported = supported;
		this.keyEligible = keyEligible;
	}

	/**
	 * @return the CQL type name used in {@code CREATE TABLE}, e.g. {@code bigint}
	 */
	@NonNull
	public String getCqlTypeName() {
		return this.cqlTypeName;
	}

	/**
	 * @return {@code true} if this type has a dedicated mapping
	 */
	public boolean isSupported() {
		return this.supported;
	}

	/**
	 * @return {@code true} if a column of this type may be part of a primary key
	 */
	public boolean canBePrimaryKey() {
		return this.keyEligible;
	}

	/**
	 * @return {@code true} for the fixed-width integer types
	 */
	public boolean isInteger() {
		return this == TINYINT || this == SMALLINT || this == INT || this == BIGINT;
	}

	/**
	 * @return {@code true} for types whose values are written as quoted string literals
	 */
	public boolean isTextual() {
		return this == TEXT || this == ENUM || this == SET || this == JSON || this == OTHER;
	}
}
