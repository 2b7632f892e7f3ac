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
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Result of a {@link TypeMapper} conversion: either a value (which may be {@code null}) or a
 * {@link TypeConversionException} describing why the conversion failed.
 * <p>
 * Failures are returned rather than thrown so callers can choose to skip, null-fill or abort.
 *
 * @param <T> the converted value's type
 * @since 1.0.0
 */
@ThreadSafe
public sealed abstract class ConversionResult<T> permits ConversionResult.Success, ConversionResult.Failure {
	private ConversionResult() {}

	/**
	 * Indicates a successful conversion.
	 *
	 * @param value the converted value, may be {@code null}
	 * @param <T>   the converted value's type
	 * @return a successful result
	 */
	@NonNull
	public static <T> ConversionResult<T> success(@Nullable T value) {
		return new Success<>(value);
	}

	/**
	 * Indicates a failed conversion.
	 *
	 * @param exception describes the failure
	 * @param <T>       the would-be converted value's type
	 * @return a failed result
	 */
	@NonNull
	public static <T> ConversionResult<T> failure(@NonNull TypeConversionException exception) {
		requireNonNull(exception);
		return new Failure<>(exception);
	}

	public abstract boolean isSuccess();

	/**
	 * @return the converted value, or empty if the conversion failed or produced {@code null}
	 */
	@NonNull
	public abstract Optional<T> getValue();

	/**
	 * @return the failure, or empty if the conversion succeeded
	 */
	@NonNull
	public abstract Optional<TypeConversionException> getFailure();

	/**
	 * Returns the converted value, throwing the carried {@link TypeConversionException} if the conversion failed.
	 *
	 * @return the converted value, possibly {@code null}
	 * @throws TypeConversionException if the conversion failed
	 */
	@Nullable
	public abstract T orElseThrow();

	/**
	 * Transforms a successful value, passing failures through untouched.
	 *
	 * @param mapper the transformation to apply
	 * @param <R>    the transformed value's type
	 * @return the transformed result
	 */
	@NonNull
	public abstract <R> ConversionResult<R> map(@NonNull Function<? super T, ? extends R> mapper);

	@ThreadSafe
	static final class Success<T> extends ConversionResult<T> {
		@Nullable
		private final T value;

		private Success(@Nullable T value) {
			this.value = value;
		}

		@Override
		public boolean isSuccess() {
			return true;
		}

		@Override
		@NonNull
		public Optional<T> getValue() {
			return Optional.ofNullable(this.value);
		}

		@Override
		@NonNull
		public Optional<TypeConversionException> getFailure() {
			return Optional.empty();
		}

		@Override
		@Nullable
		public T orElseThrow() {
			return this.value;
		}

		@Override
		@NonNull
		public <R> ConversionResult<R> map(@NonNull Function<? super T, ? extends R> mapper) {
			requireNonNull(mapper);
			return new Success<>(mapper.apply(this.value));
		}

		@Override
		public boolean equals(Object object) {
			if (this == object)
				return true;

			if (!(object instanceof Success))
				return false;

			return Objects.equals(this.value, ((Success<?>) object).value);
		}

		@Override
		public int hashCode() {
			return Objects.hashCode(this.value);
		}

		@Override
		public String toString() {
			return format("%s{value=%s}", getClass().getSimpleName(), this.value);
		}
	}

	@ThreadSafe
	static final class Failure<T> extends ConversionResult<T> {
		@NonNull
		private final TypeConversionException exception;

		private Failure(@NonNull TypeConversionException exception) {
			this.exception = exception;
		}

		@Override
		public boolean isSuccess() {
			return false;
		}

		@Override
		@NonNull
		public Optional<T> getValue() {
			return Optional.empty();
		}

		@Override
		@NonNull
		public Optional<TypeConversionException> getFailure() {
			return Optional.of(this.exception);
		}

		@Override
		@Nullable
		public T orElseThrow() {
			throw this.exception;
		}

		@Override
		@NonNull
		public <R> ConversionResult<R> map(@NonNull Function<? super T, ? extends R> mapper) {
			requireNonNull(mapper);
			return new Failure<>(this.exception);
		}

		@Override
		public String toString() {
			return format("%s{exception=%s}", getClass().getSimpleName(), this.exception);
		}
	}
}
