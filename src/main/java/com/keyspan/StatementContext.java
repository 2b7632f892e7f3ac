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
 * Data that represents a CQL statement and the table it targets.
 *
 * @since 1.0.0
 */
@ThreadSafe
public class StatementContext {
	@Nonnull
	private final Statement statement;
	@Nonnull
	private final TableSchema schema;

	protected StatementContext(@Nonnull Statement statement,
														 @Nonnull TableSchema schema) {
		requireNonNull(statement);
		requireNonNull(schema);

		this.statement = statement;
		this.schema = schema;
	}

	@Nonnull
	public static StatementContext of(@Nonnull Statement statement,
																		@Nonnull TableSchema schema) {
		return new StatementContext(statement, schema);
	}

	@Override
	public int hashCode() {
		return Objects.hash(getStatement(), getSchema());
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof StatementContext))
			return false;

		StatementContext statementContext = (StatementContext) object;

		return Objects.equals(statementContext.getStatement(), getStatement())
				&& Objects.equals(statementContext.getSchema(), getSchema());
	}

	@Override
	public String toString() {
		return format("%s{statement=%s, table=%s}", getClass().getSimpleName(), getStatement(), getSchema().getQualifiedName());
	}

	@Nonnull
	public Statement getStatement() {
		return this.statement;
	}

	@Nonnull
	public TableSchema getSchema() {
		return this.schema;
	}

	@Nonnull
	public String getKeyspace() {
		return getSchema().getKeyspace();
	}

	@Nonnull
	public String getTable() {
		return getSchema().getTable();
	}
}
