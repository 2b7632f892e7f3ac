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

import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;

/**
 * Thrown for operations which have no CQL equivalent, such as renaming a table or reading an index backwards.
 *
 * @since 1.0.0
 */
@NotThreadSafe
public class UnsupportedFeatureException extends KeyspanException {
	public UnsupportedFeatureException(@Nullable String message) {
		super(message);
	}

	public UnsupportedFeatureException(@Nullable String message,
																		 @Nullable String keyspace,
																		 @Nullable String table,
																		 @Nullable String column) {
		super(message, null, null, keyspace, table, column);
	}
}
