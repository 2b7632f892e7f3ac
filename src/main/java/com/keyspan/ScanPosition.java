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
import java.nio.ByteBuffer;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Opaque reference to a row of the result set most recently read by a {@link CqlTable}.
 * <p>
 * Serialized as {@value #SIZE} big-endian bytes holding the zero-based row index. A position is only meaningful until
 * the table runs its next query.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class ScanPosition {
	/**
	 * Width in bytes of the serialized form.
	 */
	public static final int SIZE = Long.BYTES;

	private final long rowIndex;

	private ScanPosition(long rowIndex) {
		if (rowIndex < 0)
			throw new IllegalArgumentException(format("Row index must not be negative, was %d", rowIndex));

		this.rowIndex = rowIndex;
	}

	@NonNull
	public static ScanPosition of(long rowIndex) {
		return new ScanPosition(rowIndex);
	}

	/**
	 * @param bytes exactly {@value #SIZE} bytes produced by {@link #toBytes()}
	 * @return the position
	 * @throws IllegalArgumentException if {@code bytes} is the wrong length or encodes a negative index
	 */
	@NonNull
	public static ScanPosition fromBytes(@NonNull byte[] bytes) {
		requireNonNull(bytes);

		if (bytes.length != SIZE)
			throw new IllegalArgumentException(format("Scan position must be %d bytes, was %d", SIZE, bytes.length));

		return new ScanPosition(ByteBuffer.wrap(bytes).getLong());
	}

	@NonNull
	public byte[] toBytes() {
		return ByteBuffer.allocate(SIZE).putLong(this.rowIndex).array();
	}

	public long getRowIndex() {
		return this.rowIndex;
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof ScanPosition))
			return false;

		return this.rowIndex == ((ScanPosition) object).rowIndex;
	}

	@Override
	public int hashCode() {
		return Long.hashCode(this.rowIndex);
	}

	@Override
	public String toString() {
		return format("%s{rowIndex=%d}", getClass().getSimpleName(), this.rowIndex);
	}
}
