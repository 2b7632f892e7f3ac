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

import com.keyspan.TypeConversionException.Kind;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.ThreadSafe;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.OffsetTime;
import java.time.YearMonth;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.Arrays;
import java.util.Collection;
import java.util.Date;
import java.util.HexFormat;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Basic implementation of {@link TypeMapper}.
 *
 * @since 1.0.0
 */
@ThreadSafe
class DefaultTypeMapper implements TypeMapper {
	@NonNull
	static final String NULL_LITERAL = "NULL";

	@NonNull
	private static final Pattern INTEGER_PATTERN = Pattern.compile("[+-]?\\d+");
	@NonNull
	private static final Pattern BLOB_PATTERN = Pattern.compile("0[xX]([0-9a-fA-F]{2})*");
	@NonNull
	private static final HexFormat HEX_FORMAT = HexFormat.of();
	@NonNull
	private static final BigInteger TINYINT_MIN = BigInteger.valueOf(Byte.MIN_VALUE);
	@NonNull
	private static final BigInteger TINYINT_MAX = BigInteger.valueOf(Byte.MAX_VALUE);
	@NonNull
	private static final BigInteger SMALLINT_MIN = BigInteger.valueOf(Short.MIN_VALUE);
	@NonNull
	private static final BigInteger SMALLINT_MAX = BigInteger.valueOf(Short.MAX_VALUE);
	@NonNull
	private static final BigInteger INT_MIN = BigInteger.valueOf(Integer.MIN_VALUE);
	@NonNull
	private static final BigInteger INT_MAX = BigInteger.valueOf(Integer.MAX_VALUE);
	@NonNull
	private static final BigInteger BIGINT_MIN = BigInteger.valueOf(Long.MIN_VALUE);
	@NonNull
	private static final BigInteger BIGINT_MAX = BigInteger.valueOf(Long.MAX_VALUE);

	// Accepts 2024-01-01T10:15:30, 2024-01-01 10:15:30.123 and either with a trailing offset or Z
	@NonNull
	private static final DateTimeFormatter TIMESTAMP_TEXT_FORMATTER = new DateTimeFormatterBuilder()
			.parseCaseInsensitive()
			.append(DateTimeFormatter.ISO_LOCAL_DATE)
			.optionalStart().appendLiteral('T').optionalEnd()
			.optionalStart().appendLiteral(' ').optionalEnd()
			.append(DateTimeFormatter.ISO_LOCAL_TIME)
			.optionalStart().appendOffsetId().optionalEnd()
			.toFormatter();

	@NonNull
	private final ZoneId timeZone;

	DefaultTypeMapper(@NonNull ZoneId timeZone) {
		requireNonNull(timeZone);
		this.timeZone = timeZone;
	}

	@Override
	@NonNull
	public ConversionResult<String> encode(@Nullable Object value,
																				 @NonNull ColumnDescriptor column) {
		requireNonNull(column);

		if (value == null)
			return ConversionResult.success(NULL_LITERAL);

		switch (column.getLogicalType()) {
			case TINYINT:
			case SMALLINT:
			case INT:
			case BIGINT:
				return encodeInteger(value, column);
			case FLOAT:
				return encodeFloat(value, column);
			case DOUBLE:
				return encodeDouble(value, column);
			case DECIMAL:
				return toBigDecimal(value, column).map(BigDecimal::toPlainString);
			case BLOB:
				return encodeBlob(value, column);
			case DATE:
				return toLocalDate(value, column).map(localDate ->
						format("'%04d-%02d-%02d'", localDate.getYear(), localDate.getMonthValue(), localDate.getDayOfMonth()));
			case TIME:
				return toLocalTime(value, column).map(localTime ->
						format("'%02d:%02d:%02d'", localTime.getHour(), localTime.getMinute(), localTime.getSecond()));
			case TIMESTAMP:
				return toEpochMilliseconds(value, column).map(String::valueOf);
			case BOOLEAN:
				return encodeBoolean(value, column);
			default:
				return ConversionResult.success(quote(textOf(value)));
		}
	}

	@Override
	@NonNull
	public ConversionResult<Object> decode(@Nullable String text,
																				 @NonNull ColumnDescriptor column) {
		requireNonNull(column);

		if (text == null || text.isEmpty() || NULL_LITERAL.equals(text))
			return ConversionResult.success(null);

		switch (column.getLogicalType()) {
			case TINYINT:
			case SMALLINT:
			case INT:
			case BIGINT:
				return decodeInteger(text, column);
			case FLOAT:
				return decodeFloat(text, column);
			case DOUBLE:
				return decodeDouble(text, column);
			case DECIMAL:
				return widen(toBigDecimal(text, column));
			case BLOB:
				return ConversionResult.success(decodeBlob(text));
			case DATE:
				return decodeDate(text, column);
			case TIME:
				return decodeTime(text, column);
			case TIMESTAMP:
				return ConversionResult.success(decodeTimestamp(text));
			case BOOLEAN:
				return ConversionResult.success("true".equals(text) || "1".equals(text));
			default:
				return ConversionResult.success(text);
		}
	}

	@NonNull
	protected ConversionResult<String> encodeInteger(@NonNull Object value,
																									 @NonNull ColumnDescriptor column) {
		requireNonNull(value);
		requireNonNull(column);

		BigInteger integer;

		if (value instanceof Byte || value instanceof Short || value instanceof Integer || value instanceof Long)
			integer = BigInteger.valueOf(((Number) value).longValue());
		else if (value instanceof BigInteger bigInteger)
			integer = bigInteger;
		else if (value instanceof BigDecimal bigDecimal) {
			if (bigDecimal.stripTrailingZeros().scale() > 0)
				return failure(Kind.MALFORMED, column, value, "has a fractional part");

			integer = bigDecimal.toBigInteger();
		} else if (value instanceof Double || value instanceof Float) {
			double doubleValue = ((Number) value).doubleValue();

			if (!Double.isFinite(doubleValue) || doubleValue != Math.rint(doubleValue))
				return failure(Kind.MALFORMED, column, value, "is not an integral number");

			integer = new BigDecimal(doubleValue).toBigInteger();
		} else if (value instanceof CharSequence charSequence) {
			String trimmed = charSequence.toString().trim();

			if (!INTEGER_PATTERN.matcher(trimmed).matches())
				return failure(Kind.MALFORMED, column, value, "is not an integer");

			integer = new BigInteger(trimmed);
		} else {
			return failure(Kind.INCOMPATIBLE_TYPE, column, value, format("of type %s cannot be stored as %s",
					value.getClass().getName(), column.getLogicalType().name()));
		}

		if (!inRange(integer, column.getLogicalType()))
			return failure(Kind.OUT_OF_RANGE, column, value, format("is out of range for %s", column.getLogicalType().name()));

		return ConversionResult.success(integer.toString());
	}

	@NonNull
	protected ConversionResult<Object> decodeInteger(@NonNull String text,
																									 @NonNull ColumnDescriptor column) {
		requireNonNull(text);
		requireNonNull(column);

		String trimmed = text.trim();

		if (!INTEGER_PATTERN.matcher(trimmed).matches())
			return failure(Kind.MALFORMED, column, text, "is not an integer");

		BigInteger integer = new BigInteger(trimmed);

		if (!inRange(integer, column.getLogicalType()))
			return failure(Kind.OUT_OF_RANGE, column, text, format("is out of range for %s", column.getLogicalType().name()));

		switch (column.getLogicalType()) {
			case TINYINT:
				return ConversionResult.success(integer.byteValue());
			case SMALLINT:
				return ConversionResult.success(integer.shortValue());
			case INT:
				return ConversionResult.success(integer.intValue());
			default:
				return ConversionResult.success(integer.longValue());
		}
	}

	@NonNull
	protected ConversionResult<String> encodeFloat(@NonNull Object value,
																								 @NonNull ColumnDescriptor column) {
		requireNonNull(value);
		requireNonNull(column);

		if (value instanceof Float floatValue)
			return ConversionResult.success(Float.toString(floatValue));

		ConversionResult<Double> doubleResult = toDouble(value, column);

		if (!doubleResult.isSuccess())
			return ConversionResult.failure(doubleResult.getFailure().get());

		double doubleValue = doubleResult.orElseThrow();

		if (Double.isFinite(doubleValue) && Float.isInfinite((float) doubleValue))
			return failure(Kind.OUT_OF_RANGE, column, value, "is out of range for FLOAT");

		return ConversionResult.success(Float.toString((float) doubleValue));
	}

	@NonNull
	protected ConversionResult<String> encodeDouble(@NonNull Object value,
																									@NonNull ColumnDescriptor column) {
		requireNonNull(value);
		requireNonNull(column);

		return toDouble(value, column).map(doubleValue -> Double.toString(doubleValue));
	}

	@NonNull
	protected ConversionResult<Object> decodeFloat(@NonNull String text,
																								 @NonNull ColumnDescriptor column) {
		requireNonNull(text);
		requireNonNull(column);

		ConversionResult<Double> doubleResult = toDouble(text, column);

		if (!doubleResult.isSuccess())
			return widen(doubleResult);

		double doubleValue = doubleResult.orElseThrow();

		if (Double.isFinite(doubleValue) && Float.isInfinite((float) doubleValue))
			return failure(Kind.OUT_OF_RANGE, column, text, "is out of range for FLOAT");

		return ConversionResult.success((float) doubleValue);
	}

	@NonNull
	protected ConversionResult<Object> decodeDouble(@NonNull String text,
																									@NonNull ColumnDescriptor column) {
		requireNonNull(text);
		requireNonNull(column);

		return widen(toDouble(text, column));
	}

	@NonNull
	protected ConversionResult<String> encodeBlob(@NonNull Object value,
																								@NonNull ColumnDescriptor column) {
		requireNonNull(value);
		requireNonNull(column);

		byte[] bytes;

		if (value instanceof byte[] byteArray) {
			bytes = byteArray;
		} else if (value instanceof ByteBuffer byteBuffer) {
			ByteBuffer duplicate = byteBuffer.duplicate();
			bytes = new byte[duplicate.remaining()];
			duplicate.get(bytes);
		} else {
			return failure(Kind.INCOMPATIBLE_TYPE, column, value, format("of type %s cannot be stored as BLOB",
					value.getClass().getName()));
		}

		return ConversionResult.success("0x" + HEX_FORMAT.formatHex(bytes));
	}

	@NonNull
	protected byte[] decodeBlob(@NonNull String text) {
		requireNonNull(text);

		if (BLOB_PATTERN.matcher(text).matches())
			return HEX_FORMAT.parseHex(text.substring(2));

		return text.getBytes(StandardCharsets.UTF_8);
	}

	@NonNull
	protected ConversionResult<String> encodeBoolean(@NonNull Object value,
																									 @NonNull ColumnDescriptor column) {
		requireNonNull(value);
		requireNonNull(column);

		if (value instanceof Boolean booleanValue)
			return ConversionResult.success(booleanValue ? "true" : "false");

		if (value instanceof Number number)
			return ConversionResult.success(number.longValue() != 0 ? "true" : "false");

		if (value instanceof CharSequence charSequence) {
			String trimmed = charSequence.toString().trim();

			if ("true".equalsIgnoreCase(trimmed) || "1".equals(trimmed))
				return ConversionResult.success("true");
			if ("false".equalsIgnoreCase(trimmed) || "0".equals(trimmed))
				return ConversionResult.success("false");

			return failure(Kind.MALFORMED, column, value, "is not a boolean");
		}

		return failure(Kind.INCOMPATIBLE_TYPE, column, value, format("of type %s cannot be stored as BOOLEAN",
				value.getClass().getName()));
	}

	@NonNull
	protected ConversionResult<Object> decodeDate(@NonNull String text,
																								@NonNull ColumnDescriptor column) {
		requireNonNull(text);
		requireNonNull(column);

		int[] fields = scanIntegers(text, '-', 3);

		if (fields == null)
			return failure(Kind.MALFORMED, column, text, "is not a date");

		int year = fields[0];
		int month = fields[1] == Integer.MIN_VALUE ? 1 : fields[1];
		int day = fields[2] == Integer.MIN_VALUE ? 1 : fields[2];

		if (month < 1 || month > 12 || day < 1 || day > YearMonth.of(year, month).lengthOfMonth())
			return failure(Kind.MALFORMED, column, text, "is not a valid calendar date");

		return ConversionResult.success(LocalDate.of(year, month, day));
	}

	@NonNull
	protected ConversionResult<Object> decodeTime(@NonNull String text,
																								@NonNull ColumnDescriptor column) {
		requireNonNull(text);
		requireNonNull(column);

		int[] fields = scanIntegers(text, ':', 3);

		if (fields == null)
			return failure(Kind.MALFORMED, column, text, "is not a time");

		int hour = fields[0];
		int minute = fields[1] == Integer.MIN_VALUE ? 0 : fields[1];
		int second = fields[2] == Integer.MIN_VALUE ? 0 : fields[2];

		if (hour < 0 || hour > 23 || minute < 0 || minute > 59 || second < 0 || second > 59)
			return failure(Kind.MALFORMED, column, text, "is not a valid time of day");

		return ConversionResult.success(LocalTime.of(hour, minute, second));
	}

	/**
	 * Decodes epoch milliseconds into calendar fields in this mapper's zone. Non-numeric text is tried as an ISO-8601
	 * timestamp and finally returned unchanged.
	 */
	@NonNull
	protected Object decodeTimestamp(@NonNull String text) {
		requireNonNull(text);

		String trimmed = text.trim();

		if (INTEGER_PATTERN.matcher(trimmed).matches()) {
			BigInteger milliseconds = new BigInteger(trimmed);

			if (inRange(milliseconds, LogicalType.BIGINT))
				return LocalDateTime.ofInstant(Instant.ofEpochMilli(milliseconds.longValue()), getTimeZone());

			return text;
		}

		try {
			TemporalAccessor temporalAccessor = TIMESTAMP_TEXT_FORMATTER.parseBest(trimmed, OffsetDateTime::from, LocalDateTime::from);

			if (temporalAccessor instanceof OffsetDateTime offsetDateTime)
				return LocalDateTime.ofInstant(offsetDateTime.toInstant(), getTimeZone());

			return temporalAccessor;
		} catch (DateTimeParseException ignored) {
			// Neither epoch milliseconds nor a timestamp we understand; keep what the store gave us
			return text;
		}
	}

	@NonNull
	protected ConversionResult<Double> toDouble(@NonNull Object value,
																							@NonNull ColumnDescriptor column) {
		requireNonNull(value);
		requireNonNull(column);

		if (value instanceof Number number)
			return ConversionResult.success(number.doubleValue());

		if (value instanceof CharSequence charSequence) {
			try {
				return ConversionResult.success(Double.parseDouble(charSequence.toString().trim()));
			} catch (NumberFormatException e) {
				return failure(Kind.MALFORMED, column, value, "is not a number", e);
			}
		}

		return failure(Kind.INCOMPATIBLE_TYPE, column, value, format("of type %s cannot be stored as %s",
				value.getClass().getName(), column.getLogicalType().name()));
	}

	@NonNull
	protected ConversionResult<BigDecimal> toBigDecimal(@NonNull Object value,
																											@NonNull ColumnDescriptor column) {
		requireNonNull(value);
		requireNonNull(column);

		BigDecimal bigDecimal;

		if (value instanceof BigDecimal decimal) {
			bigDecimal = decimal;
		} else if (value instanceof BigInteger bigInteger) {
			bigDecimal = new BigDecimal(bigInteger);
		} else if (value instanceof Byte || value instanceof Short || value instanceof Integer || value instanceof Long) {
			bigDecimal = BigDecimal.valueOf(((Number) value).longValue());
		} else if (value instanceof Double || value instanceof Float) {
			double doubleValue = ((Number) value).doubleValue();

			if (!Double.isFinite(doubleValue))
				return failure(Kind.MALFORMED, column, value, "is not a finite number");

			bigDecimal = value instanceof Float ? new BigDecimal(value.toString()) : BigDecimal.valueOf(doubleValue);
		} else if (value instanceof CharSequence charSequence) {
			try {
				bigDecimal = new BigDecimal(charSequence.toString().trim());
			} catch (NumberFormatException e) {
				return failure(Kind.MALFORMED, column, value, "is not a decimal number", e);
			}
		} else {
			return failure(Kind.INCOMPATIBLE_TYPE, column, value, format("of type %s cannot be stored as DECIMAL",
					value.getClass().getName()));
		}

		Integer scale = column.getScale().orElse(null);

		if (scale != null)
			bigDecimal = bigDecimal.setScale(scale, RoundingMode.HALF_UP);

		return ConversionResult.success(bigDecimal);
	}

	@NonNull
	protected ConversionResult<LocalDate> toLocalDate(@NonNull Object value,
																										@NonNull ColumnDescriptor column) {
		requireNonNull(value);
		requireNonNull(column);

		if (value instanceof LocalDate localDate)
			return ConversionResult.success(localDate);
		if (value instanceof LocalDateTime localDateTime)
			return ConversionResult.success(localDateTime.toLocalDate());
		if (value instanceof OffsetDateTime offsetDateTime)
			return ConversionResult.success(offsetDateTime.atZoneSameInstant(getTimeZone()).toLocalDate());
		if (value instanceof ZonedDateTime zonedDateTime)
			return ConversionResult.success(zonedDateTime.withZoneSameInstant(getTimeZone()).toLocalDate());
		if (value instanceof Instant instant)
			return ConversionResult.success(LocalDate.ofInstant(instant, getTimeZone()));
		if (value instanceof Date date)
			return ConversionResult.success(LocalDate.ofInstant(date.toInstant(), getTimeZone()));
		if (value instanceof CharSequence charSequence)
			return decodeDate(charSequence.toString(), column).map(LocalDate.class::cast);

		return failure(Kind.INCOMPATIBLE_TYPE, column, value, format("of type %s cannot be stored as DATE",
				value.getClass().getName()));
	}

	@NonNull
	protected ConversionResult<LocalTime> toLocalTime(@NonNull Object value,
																										@NonNull ColumnDescriptor column) {
		requireNonNull(value);
		requireNonNull(column);

		if (value instanceof LocalTime localTime)
			return ConversionResult.success(localTime);
		if (value instanceof LocalDateTime localDateTime)
			return ConversionResult.success(localDateTime.toLocalTime());
		if (value instanceof OffsetTime offsetTime)
			return ConversionResult.success(offsetTime.toLocalTime());
		if (value instanceof CharSequence charSequence)
			return decodeTime(charSequence.toString(), column).map(LocalTime.class::cast);

		return failure(Kind.INCOMPATIBLE_TYPE, column, value, format("of type %s cannot be stored as TIME",
				value.getClass().getName()));
	}

	/**
	 * Calendar values are interpreted in this mapper's zone; instants are used as-is.
	 */
	@NonNull
	protected ConversionResult<Long> toEpochMilliseconds(@NonNull Object value,
																											 @NonNull ColumnDescriptor column) {
		requireNonNull(value);
		requireNonNull(column);

		Instant instant;

		if (value instanceof LocalDateTime localDateTime)
			instant = localDateTime.atZone(getTimeZone()).toInstant();
		else if (value instanceof LocalDate localDate)
			instant = localDate.atStartOfDay(getTimeZone()).toInstant();
		else if (value instanceof Instant instantValue)
			instant = instantValue;
		else if (value instanceof OffsetDateTime offsetDateTime)
			instant = offsetDateTime.toInstant();
		else if (value instanceof ZonedDateTime zonedDateTime)
			instant = zonedDateTime.toInstant();
		else if (value instanceof Date date)
			instant = date.toInstant();
		else if (value instanceof Byte || value instanceof Short || value instanceof Integer || value instanceof Long)
			return ConversionResult.success(((Number) value).longValue());
		else if (value instanceof CharSequence charSequence) {
			Object decoded = decodeTimestamp(charSequence.toString());

			if (decoded instanceof LocalDateTime localDateTime)
				instant = localDateTime.atZone(getTimeZone()).toInstant();
			else
				return failure(Kind.MALFORMED, column, value, "is not a timestamp");
		} else {
			return failure(Kind.INCOMPATIBLE_TYPE, column, value, format("of type %s cannot be stored as TIMESTAMP",
					value.getClass().getName()));
		}

		try {
			return ConversionResult.success(instant.toEpochMilli());
		} catch (ArithmeticException e) {
			return failure(Kind.OUT_OF_RANGE, column, value, "is out of range for TIMESTAMP", e);
		}
	}

	/**
	 * Wraps {@code text} in single quotes, doubling any embedded single quotes.
	 *
	 * @param text the text to quote
	 * @return a CQL string literal
	 */
	@NonNull
	protected String quote(@NonNull String text) {
		requireNonNull(text);
		return "'" + text.replace("'", "''") + "'";
	}

	@NonNull
	protected String textOf(@NonNull Object value) {
		requireNonNull(value);

		if (value instanceof Enum<?> enumValue)
			return enumValue.name();

		if (value instanceof Collection<?> collection)
			return collection.stream().map(element -> textOf(element == null ? "" : element)).collect(Collectors.joining(","));

		if (value instanceof byte[] bytes)
			return new String(bytes, StandardCharsets.UTF_8);

		return value.toString();
	}

	/**
	 * Tolerant scan of up to {@code count} integers separated by {@code separator}, in the manner of
	 * {@code sscanf("%d-%d-%d")}: leading whitespace is skipped, scanning stops at the first character that does not fit,
	 * and trailing text is ignored. Components which were not reached are {@link Integer#MIN_VALUE}.
	 *
	 * @return the scanned components, or {@code null} if not even the first integer is present
	 */
	@Nullable
	static int[] scanIntegers(@NonNull String text,
														char separator,
														int count) {
		requireNonNull(text);

		int[] fields = new int[count];
		Arrays.fill(fields, Integer.MIN_VALUE);

		int position = 0;
		int length = text.length();

		for (int i = 0; i < count; ++i) {
			if (i > 0) {
				if (position >= length || text.charAt(position) != separator)
					break;

				++position;
			}

			while (position < length && Character.isWhitespace(text.charAt(position)))
				++position;

			int start = position;

			if (position < length && (text.charAt(position) == '+' || text.charAt(position) == '-'))
				++position;

			int digitsStart = position;

			while (position < length && Character.isDigit(text.charAt(position)) && position - digitsStart < 9)
				++position;

			if (position == digitsStart)
				break;

			fields[i] = Integer.parseInt(text.substring(start, position));
		}

		return fields[0] == Integer.MIN_VALUE ? null : fields;
	}

	private static boolean inRange(@NonNull BigInteger integer,
																 @NonNull LogicalType logicalType) {
		switch (logicalType) {
			case TINYINT:
				return integer.compareTo(TINYINT_MIN) >= 0 && integer.compareTo(TINYINT_MAX) <= 0;
			case SMALLINT:
				return integer.compareTo(SMALLINT_MIN) >= 0 && integer.compareTo(SMALLINT_MAX) <= 0;
			case INT:
				return integer.compareTo(INT_MIN) >= 0 && integer.compareTo(INT_MAX) <= 0;
			default:
				return integer.compareTo(BIGINT_MIN) >= 0 && integer.compareTo(BIGINT_MAX) <= 0;
		}
	}

	@SuppressWarnings("unchecked")
	@NonNull
	private static ConversionResult<Object> widen(@NonNull ConversionResult<?> conversionResult) {
		return (ConversionResult<Object>) conversionResult;
	}

	@NonNull
	private static <T> ConversionResult<T> failure(@NonNull Kind kind,
																								 @NonNull ColumnDescriptor column,
																								 @Nullable Object input,
																								 @NonNull String problem) {
		return failure(kind, column, input, problem, null);
	}

	@NonNull
	private static <T> ConversionResult<T> failure(@NonNull Kind kind,
																								 @NonNull ColumnDescriptor column,
																								 @Nullable Object input,
																								 @NonNull String problem,
																								 @Nullable Throwable cause) {
		return ConversionResult.failure(new TypeConversionException(kind, column.getName(), column.getLogicalType(), input,
				format("Value '%s' for column '%s' %s", input, column.getName(), problem), cause));
	}

	@NonNull
	protected ZoneId getTimeZone() {
		return this.timeZone;
	}
}
