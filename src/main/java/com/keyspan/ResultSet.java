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

import javax.annotation.concurrent.ThreadSafe;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * The column names a statement returned plus its rows of textual cells.
 * <p>
 * Column order and completeness are whatever the cluster chose and need not match the {@link TableSchema}.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class ResultSet {
	@NonNull
	private static final ResultSet EMPTY = new ResultSet(List.of(), List.of());

	@NonNull
	private final List<String> columnNames;
	@NonNull
	private final List<ResultRow> rows;

	private ResultSet(@NonNull List<String> columnNames,
										@NonNull List<ResultRow> rows) {
		requireNonNull(columnNames);
		requireNonNull(rows);

		for (int i = 0; i < rows.size(); ++i)
			if (rows.get(i).size() != columnNames.size())
				throw new IllegalArgumentException(format("Row %d has %d cell[s] but there are %d column[s]",
						i, rows.get(i).size(), columnNames.size()));

		this.columnNames = Collections.unmodifiableList(new ArrayList<>(columnNames));
		this.rows = Collections.unmodifiableList(new ArrayList<>(rows));
	}

	/**
	 * @return a result set with no columns and no rows, as returned by statements which are not queries
	 */
	@NonNull
	public static ResultSet empty() {
		return EMPTY;
	}

	@NonNull
	public static ResultSet of(@NonNull List<String> columnNames,
														 @NonNull List<ResultRow> rows) {
		return new ResultSet(columnNames, rows);
	}

	@NonNull
	public List<String> getColumnNames() {
		return this.columnNames;
	}

	@NonNull
	public List<ResultRow> getRows() {
		return this.rows;
	}

	public int getRowCount() {
		return this.rows.size();
	}

	public boolean isEmpty() {
		return this.rows.isEmpty();
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof ResultSet))
			return false;

		ResultSet resultSet = (ResultSet) object;

		return Objects.equals(getColumnNames(), resultSet.getColumnNames())
				&& Objects.equals(getRows(), resultSet.getRows());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getColumnNames(), getRows());
	}

	@Override
	public String toString() {
		return format("%s{columnNames=%s, rowCount=%d}", getClass().getSimpleName(), getColumnNames(), getRowCount());
	}
}
