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

/**
 * The part a column plays in its table's primary key.
 *
 * @since 1.0.0
 */
public enum ColumnRole {
	REGULAR,
	PARTITION_KEY,
	CLUSTERING_KEY;

	public boolean isKey() {
		return this != REGULAR;
	}
}
