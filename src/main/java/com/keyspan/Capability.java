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
 * Access paths a storage layer may offer its host.
 * <p>
 * {@link CqlTable#getCapabilities()} reports which ones Keyspan provides. Anything not provided must be served by a
 * full scan with filtering done by the caller, as {@link CqlTable#scan(java.util.function.Predicate)} does.
 *
 * @since 1.0.0
 */
public enum Capability {
	/**
	 * Rows can be read one after another with a forward-only cursor.
	 */
	FORWARD_SCAN,
	/**
	 * A row previously read can be fetched again by its {@link ScanPosition}.
	 */
	POSITIONAL_READ,
	/**
	 * Rows can be fetched by equality on a prefix of the primary key.
	 */
	KEY_LOOKUP,
	FULL_TABLE_SCAN,
	RANGE_SCAN,
	ORDERED_SCAN,
	REVERSE_SCAN,
	SECONDARY_INDEX_SCAN
}
