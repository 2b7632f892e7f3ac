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

import static java.util.Objects.requireNonNull;

/**
 * Thrown when the cluster rejects a well-formed statement, for example because of a schema mismatch.
 *
 * @since 1.0.0
 */
@NotThreadSafe
public class StatementExecutionException extends KeyspanException {
	/**
	 * Creates an exception for the rejected {@code cql}.
	 *
	 * @param message a message describing the rejection
	 * @param cql     the statement the cluster rejected
	 * @param cause   the driver-level cause, if any
	 */
	public StatementExecutionException(@Nullable String message,
																		 @NonNull String cql,
																		 @Nullable Throwable cause) {
		super(message, cause, requireNonNull(cql), null, null, null);
	}
}
