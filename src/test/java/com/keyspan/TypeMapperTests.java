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
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.List;

/**
 * @since 1.0.0
 */
public class TypeMapperTests {
	private final TypeMapper typeMapper = TypeMapper.withDefaultConfiguration();

	@Test
	public void testIntegerBoundsRoundTrip() {
		Assertions.assertEquals("-128", typeMapper.encode((byte) -128, LogicalType.TINYINT).orElseThrow());
		Assertions.assertEquals("127", typeMapper.encode(Byte.MAX_VALUE, LogicalType.TINYINT).orElseThrow());
		Assertions.assertEquals("-32768", typeMapper.encode(Short.MIN_VALUE, LogicalType.SMALLINT).orElseThrow());
		Assertions.assertEquals("2147483647", typeMapper.encode(Integer.MAX_VALUE, LogicalType.INT).orElseThrow());
		Assertions.assertEquals("-9223372036854775808", typeMapper.encode(Long.MIN_VALUE, LogicalType.BIGINT).orElseThrow());

		Assertions.assertEquals((byte) -128, typeMapper.decode("-128", LogicalType.TINYINT).orElseThrow());
		Assertions.assertEquals(Short.MAX_VALUE, typeMapper.decode("32767", LogicalType.SMALLINT).orElseThrow());
		Assertions.assertEquals(Integer.MIN_VALUE, typeMapper.decode("-2147483648", LogicalType.INT).orElseThrow());
		Assertions.assertEquals(Long.MAX_VALUE, typeMapper.decode("9223372036854775807", LogicalType.BIGINT).orElseThrow());
	}

	@Test
	public void testIntegerOutOfRangeIsNeverClamped() {
		ConversionResult<Object> decoded = typeMapper.decode("128", LogicalType.TINYINT);
		Assertions.assertFalse(decoded.isSuccess(), "128 does not fit in a TINYINT");
		Assertions.assertEquals(Kind.OUT_OF_RANGE, decoded.getFailure().get().getKind());

		ConversionResult<String> encoded = typeMapper.encode(40000, LogicalType.SMALLINT);
		Assertions.assertEquals(Kind.OUT_OF_RANGE, encoded.getFailure().get().getKind());

		ConversionResult<Object> overflow = typeMapper.decode("9223372036854775808", LogicalType.BIGINT);
		Assertions.assertEquals(Kind.OUT_OF_RANGE, overflow.getFailure().get().getKind());
	}

	@Test
	public void testMalformedIntegers() {
		Assertions.assertEquals(Kind.MALFORMED, typeMapper.decode("12abc", LogicalType.INT).getFailure().get().getKind());
		Assertions.assertEquals(Kind.MALFORMED, typeMapper.encode("seven", LogicalType.INT).getFailure().get().getKind());
		Assertions.assertEquals(Kind.MALFORMED, typeMapper.encode(1.5, LogicalType.BIGINT).getFailure().get().getKind());
		Assertions.assertEquals(Kind.INCOMPATIBLE_TYPE,
				typeMapper.encode(LocalDate.of(2024, 1, 1), LogicalType.INT).getFailure().get().getKind());
	}

	@Test
	public void testFailureThrowsTypedException() {
		TypeConversionException exception = Assertions.assertThrows(TypeConversionException.class,
				() -> typeMapper.encode("x", ColumnDescriptor.of("age", LogicalType.INT)).orElseThrow());

		Assertions.assertEquals("age", exception.getColumn().orElse(null));
		Assertions.assertEquals(LogicalType.INT, exception.getLogicalType());
		Assertions.assertEquals("x", exception.getInput().orElse(null));
	}

	@Test
	public void testNulls() {
		Assertions.assertEquals("NULL", typeMapper.encode(null, LogicalType.TEXT).orElseThrow());
		Assertions.assertEquals("NULL", typeMapper.encode(null, LogicalType.INT).orElseThrow());
		Assertions.assertNull(typeMapper.decode("NULL", LogicalType.INT).orElseThrow());
		Assertions.assertNull(typeMapper.decode("", LogicalType.TEXT).orElseThrow());
		Assertions.assertNull(typeMapper.decode(null, LogicalType.DATE).orElseThrow());
	}

	@Test
	public void testTextQuoting() {
		Assertions.assertEquals("'O''Brien'", typeMapper.encode("O'Brien", LogicalType.TEXT).orElseThrow());
		Assertions.assertEquals("''''''", typeMapper.encode("''", LogicalType.TEXT).orElseThrow());
		Assertions.assertEquals("O'Brien", typeMapper.decode("O'Brien", LogicalType.TEXT).orElseThrow());
		Assertions.assertEquals("'RED'", typeMapper.encode(Color.RED, LogicalType.ENUM).orElseThrow());
		Assertions.assertEquals("'a,b'", typeMapper.encode(List.of("a", "b"), LogicalType.SET).orElseThrow());
		Assertions.assertEquals("'{\"k\": 1}'", typeMapper.encode("{\"k\": 1}", LogicalType.JSON).orElseThrow());
	}

	@Test
	public void testUnknownTypesFallBackToText() {
		Assertions.assertEquals("'point(1 2)'", typeMapper.encode("point(1 2)", LogicalType.OTHER).orElseThrow());
		Assertions.assertEquals("point(1 2)", typeMapper.decode("point(1 2)", LogicalType.OTHER).orElseThrow());
		Assertions.assertEquals("text", typeMapper.cqlTypeName(LogicalType.OTHER));
	}

	@Test
	public void testFloatingPoint() {
		Assertions.assertEquals("0.1", typeMapper.encode(0.1f, LogicalType.FLOAT).orElseThrow());
		Assertions.assertEquals("0.30000000000000004", typeMapper.encode(0.1 + 0.2, LogicalType.DOUBLE).orElseThrow());
		Assertions.assertEquals(0.1 + 0.2, typeMapper.decode("0.30000000000000004", LogicalType.DOUBLE).orElseThrow());
		Assertions.assertEquals(3.4028235E38f, typeMapper.decode("3.4028235E38", LogicalType.FLOAT).orElseThrow());
		Assertions.assertEquals(Kind.OUT_OF_RANGE, typeMapper.encode(1e300, LogicalType.FLOAT).getFailure().get().getKind());
		Assertions.assertEquals(Kind.MALFORMED, typeMapper.decode("pi", LogicalType.DOUBLE).getFailure().get().getKind());
	}

	@Test
	public void testDecimal() {
		ColumnDescriptor price = ColumnDescriptor.withName("price", LogicalType.DECIMAL).scale(2).build();

		Assertions.assertEquals("12345678901234567890.123456789",
				typeMapper.encode(new BigDecimal("12345678901234567890.123456789"), LogicalType.DECIMAL).orElseThrow());
		Assertions.assertEquals("1.24", typeMapper.encode(new BigDecimal("1.235"), price).orElseThrow());
		Assertions.assertEquals(new BigDecimal("1.50"), typeMapper.decode("1.5", price).orElseThrow());
		Assertions.assertEquals(new BigDecimal("1E+3"), typeMapper.decode("1E+3", LogicalType.DECIMAL).orElseThrow());
		Assertions.assertEquals(Kind.MALFORMED, typeMapper.decode("1.2.3", LogicalType.DECIMAL).getFailure().get().getKind());
	}

	@Test
	public void testBlob() {
		Assertions.assertEquals("0x00ff10", typeMapper.encode(new byte[]{0x00, (byte) 0xFF, 0x10}, LogicalType.BLOB).orElseThrow());
		Assertions.assertArrayEquals(new byte[]{0x00, (byte) 0xFF, 0x10},
				(byte[]) typeMapper.decode("0x00FF10", LogicalType.BLOB).orElseThrow());
		Assertions.assertArrayEquals("abc".getBytes(StandardCharsets.UTF_8),
				(byte[]) typeMapper.decode("abc", LogicalType.BLOB).orElseThrow());
		Assertions.assertEquals(Kind.INCOMPATIBLE_TYPE,
				typeMapper.encode(LocalDate.of(2024, 1, 1), LogicalType.BLOB).getFailure().get().getKind());
	}

	@Test
	public void testDateAndTime() {
		Assertions.assertEquals("'0987-03-04'", typeMapper.encode(LocalDate.of(987, 3, 4), LogicalType.DATE).orElseThrow());
		Assertions.assertEquals(LocalDate.of(2024, 2, 29), typeMapper.decode("2024-02-29", LogicalType.DATE).orElseThrow());
		Assertions.assertEquals(LocalDate.of(2024, 1, 1), typeMapper.decode("2024", LogicalType.DATE).orElseThrow(),
				"Missing month and day default to the first");
		Assertions.assertEquals(Kind.MALFORMED, typeMapper.decode("2023-02-29", LogicalType.DATE).getFailure().get().getKind());

		Assertions.assertEquals("'07:05:09'", typeMapper.encode(LocalTime.of(7, 5, 9, 123_000_000), LogicalType.TIME).orElseThrow());
		Assertions.assertEquals(LocalTime.of(10, 15, 30), typeMapper.decode("10:15:30.000123", LogicalType.TIME).orElseThrow(),
				"Sub-second suffix is ignored");
		Assertions.assertEquals(Kind.MALFORMED, typeMapper.decode("noon", LogicalType.TIME).getFailure().get().getKind());
	}

	@Test
	public void testTimestampRoundTripInUtc() {
		LocalDateTime timestamp = LocalDateTime.of(2024, 1, 1, 0, 0, 0, 500_000_000);

		Assertions.assertEquals("1704067200500", typeMapper.encode(timestamp, LogicalType.TIMESTAMP).orElseThrow());
		Assertions.assertEquals(timestamp, typeMapper.decode("1704067200500", LogicalType.TIMESTAMP).orElseThrow());
		Assertions.assertEquals("1704067200500",
				typeMapper.encode(Instant.ofEpochMilli(1704067200500L), LogicalType.TIMESTAMP).orElseThrow());
	}

	@Test
	public void testTimestampUsesConfiguredZone() {
		TypeMapper tokyo = TypeMapper.withTimeZone(ZoneId.of("Asia/Tokyo"));
		LocalDateTime timestamp = LocalDateTime.of(2024, 1, 1, 9, 0);

		Assertions.assertEquals("1704067200000", tokyo.encode(timestamp, LogicalType.TIMESTAMP).orElseThrow());
		Assertions.assertEquals(timestamp, tokyo.decode("1704067200000", LogicalType.TIMESTAMP).orElseThrow());
	}

	@Test
	public void testTimestampTextFallbacks() {
		Assertions.assertEquals(LocalDateTime.of(2024, 1, 1, 10, 15, 30),
				typeMapper.decode("2024-01-01T10:15:30", LogicalType.TIMESTAMP).orElseThrow());
		Assertions.assertEquals(LocalDateTime.of(2024, 1, 1, 8, 15, 30),
				typeMapper.decode("2024-01-01 10:15:30+02:00", LogicalType.TIMESTAMP).orElseThrow());
		Assertions.assertEquals("sometime", typeMapper.decode("sometime", LogicalType.TIMESTAMP).orElseThrow(),
				"Unrecognized text is returned verbatim");
	}

	@Test
	public void testBoolean() {
		Assertions.assertEquals("true", typeMapper.encode(true, LogicalType.BOOLEAN).orElseThrow());
		Assertions.assertEquals("false", typeMapper.encode(0, LogicalType.BOOLEAN).orElseThrow());
		Assertions.assertEquals(true, typeMapper.decode("true", LogicalType.BOOLEAN).orElseThrow());
		Assertions.assertEquals(true, typeMapper.decode("1", LogicalType.BOOLEAN).orElseThrow());
		Assertions.assertEquals(false, typeMapper.decode("yes", LogicalType.BOOLEAN).orElseThrow());
	}

	@Test
	public void testCqlTypeNames() {
		Assertions.assertEquals("tinyint", typeMapper.cqlTypeName(LogicalType.TINYINT));
		Assertions.assertEquals("bigint", typeMapper.cqlTypeName(LogicalType.BIGINT));
		Assertions.assertEquals("decimal", typeMapper.cqlTypeName(LogicalType.DECIMAL));
		Assertions.assertEquals("blob", typeMapper.cqlTypeName(LogicalType.BLOB));
		Assertions.assertEquals("text", typeMapper.cqlTypeName(LogicalType.ENUM));
		Assertions.assertEquals("timestamp", typeMapper.cqlTypeName(LogicalType.TIMESTAMP));
		Assertions.assertFalse(LogicalType.BLOB.canBePrimaryKey(), "Blobs cannot be keys");
		Assertions.assertFalse(LogicalType.OTHER.isSupported());
	}

	enum Color {
		RED,
		GREEN
	}
}
