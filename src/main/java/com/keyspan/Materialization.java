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

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A decoded {@link Row} plus any cells which failed to decode.
 * <p>
 * Columns whose cells failed to decode are present in the row with a {@code null} value.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class Materialization {
	@NonNull
	private final Row row;
	@NonNull
	private final List<TypeConversionException> failures;

	private Materialization(@NonNull Row row,
													@NonNull List<TypeConversionException> failures) {
		requireNonNull(row);
		requireNonNull(failures);

		this.row = row;
		this.failures = Collections.unmodifiableList(new ArrayList<>(failures));
	}

	@NonNull
	public static Materialization of(@NonNull Row row,
																	 @NonNull List<TypeConversionException> failures) {
		return new Materialization(row, failures);
	}

	@NonNull
	public Row getRow() {
		return this.row;
	}

	@NonNull
	public List<TypeConversionException> getFailures() {
		return this.failures;
	}

	public boolean hasFailures() {
		return !this.failures.isEmpty();
	}

	@Override
	public String toString() {
		return format("%s{row=%s, failures=%s}", getClass().getSimpleName(), getRow(), getFailures());
	}
}
