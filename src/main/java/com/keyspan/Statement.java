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
import javax.annotation.concurrent.ThreadSafe;
import java.util.Objects;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Represents a CQL statement, its kind, and an identifier for it.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class Statement {
	@Nonnull
	private final Object id;
	@Nonnull
	private final StatementKind kind;
	@Nonnull
	private final String cql;

	private Statement(@Nonnull Object id,
										@Nonnull StatementKind kind,
										@Nonnull String cql) {
		requireNonNull(id);
		requireNonNull(kind);
		requireNonNull(cql);

		this.id = id;
		this.kind = kind;
		this.cql = cql;
	}

	/**
	 * Factory method for providing {@link Statement} instances.
	 *
	 * @param id   the statement's identifier
	 * @param kind the statement's shape
	 * @param cql  the CQL being identified
	 * @return a statement instance
	 */
	@Nonnull
	public static Statement of(@Nonnull Object id,
														 @Nonnull StatementKind kind,
														 @Nonnull String cql) {
		requireNonNull(id);
		requireNonNull(kind);
		requireNonNull(cql);

		return new Statement(id, kind, cql);
	}

	@Override
	public int hashCode() {
		return Objects.hash(getId(), getKind(), getCql());
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof Statement))
			return false;

		Statement statement = (Statement) object;

		return Objects.equals(statement.getId(), getId())
				&& Objects.equals(statement.getKind(), getKind())
				&& Objects.equals(statement.getCql(), getCql());
	}

	@Override
	@Nonnull
	public String toString() {
		return format("%s{id=%s, kind=%s, cql=%s}", getClass().getSimpleName(), getId(), getKind().name(), getCql());
	}

	@Nonnull
	public Object getId() {
		return this.id;
	}

	@Nonnull
	public StatementKind getKind() {
		return this.kind;
	}

	@Nonnull
	public String getCql() {
		return this.cql;
	}
}
