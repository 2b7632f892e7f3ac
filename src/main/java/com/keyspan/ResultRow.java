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
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * One row of textual cells, positionally aligned with the column names of its {@link ResultSet}.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class ResultRow {
	@NonNull
	private final List<@Nullable String> cells;

	private ResultRow(@NonNull List<@Nullable String> cells) {
		requireNonNull(cells);
		this.cells = Collections.unmodifiableList(new ArrayList<>(cells));
	}

	@NonNull
	public static ResultRow of(@NonNull List<@Nullable String> cells) {
		return new ResultRow(cells);
	}

	@NonNull
	public static ResultRow of(@Nullable String @NonNull ... cells) {
		requireNonNull(cells);
		return new ResultRow(Arrays.asList(cells));
	}

	@NonNull
	public List<@Nullable String> getCells() {
		return this.cells;
	}

	@Nullable
	public String getCell(int index) {
		return this.cells.get(index);
	}

	public int size() {
		return this.cells.size();
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof ResultRow))
			return false;

		return Objects.equals(getCells(), ((ResultRow) object).getCells());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getCells());
	}

	@Override
	public String toString() {
		return format("%s{cells=%s}", getClass().getSimpleName(), getCells());
	}
}
