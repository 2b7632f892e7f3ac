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

import com.datastax.oss.driver.api.core.data.CqlDuration;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.ThreadSafe;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.net.InetAddress;
import java.nio.ByteBuffer;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.HexFormat;
import java.util.UUID;

import static java.util.Objects.requireNonNull;

/**
 * Turns the Java values the DataStax driver decodes cells into back into the text form {@link TypeMapper} decodes.
 *
 * @since 1.0.0
 */
@ThreadSafe
public class DriverValueFormatter {
	@NonNull
	public static final String UNSUPPORTED_TYPE = "[UNSUPPORTED_TYPE]";

	private static final long NANOS_PER_SECOND = 1_000_000_000L;

	@NonNull
	public String format(@Nullable Object value) {
		if (value == null)
			return DefaultTypeMapper.NULL_LITERAL;

		if (value instanceof Byte || value instanceof Short || value instanceof Integer || value instanceof Long
				|| value instanceof BigInteger)
			return value.toString();

		if (value instanceof Float floatValue)
			return Float.toString(floatValue);

		if (value instanceof Double doubleValue)
			return Double.toString(doubleValue);

		if (value instanceof BigDecimal bigDecimal)
			return bigDecimal.toPlainString();

		if (value instanceof Boolean booleanValue)
			return booleanValue ? "1" : "0";

		if (value instanceof String string)
			return string;

		// Epoch milliseconds
		if (value instanceof Instant instant)
			return String.valueOf(instant.toEpochMilli());

		if (value instanceof LocalDate localDate)
			return String.format("%04d-%02d-%02d", localDate.getYear(), localDate.getMonthValue(), localDate.getDayOfMonth());

		if (value instanceof LocalTime localTime)
			return String.format("%02d:%02d:%02d.%06d", localTime.getHour(), localTime.getMinute(), localTime.getSecond(),
					localTime.getNano() / 1_000);

		if (value instanceof ByteBuffer byteBuffer) {
			ByteBuffer duplicate = byteBuffer.duplicate();
			byte[] bytes = new byte[duplicate.remaining()];
			duplicate.get(bytes);
			return "0x" + HexFormat.of().formatHex(bytes);
		}

		if (value instanceof UUID uuid)
			return uuid.toString();

		if (value instanceof InetAddress inetAddress)
			return inetAddress.getHostAddress();

		if (value instanceof CqlDuration cqlDuration)
			return formatDuration(cqlDuration);

		return UNSUPPORTED_TYPE;
	}

	/**
	 * Formats as ISO-8601, e.g. {@code P1M2DT3H4M5.25S}. A zero duration is {@code PT0S}.
	 */
	@NonNull
	protected String formatDuration(@NonNull CqlDuration duration) {
		requireNonNull(duration);

		int months = duration.getMonths();
		int days = duration.getDays();
		long nanoseconds = duration.getNanoseconds();

		if (months == 0 && days == 0 && nanoseconds == 0)
			return "PT0S";

		StringBuilder iso = new StringBuilder("P");

		if (months != 0)
			iso.append(months).append('M');

		if (days != 0)
			iso.append(days).append('D');

		if (nanoseconds != 0) {
			long totalSeconds = nanoseconds / NANOS_PER_SECOND;
			long hours = totalSeconds / 3600;
			long minutes = (totalSeconds % 3600) / 60;
			long seconds = totalSeconds % 60;
			long fraction = Math.abs(nanoseconds % NANOS_PER_SECOND);

			iso.append('T');

			if (hours != 0)
				iso.append(hours).append('H');

			if (minutes != 0)
				iso.append(minutes).append('M');

			if (seconds != 0 || fraction != 0) {
				iso.append(seconds);

				if (fraction != 0)
					iso.append('.').append(stripTrailingZeros(String.format("%09d", fraction)));

				iso.append('S');
			}
		}

		return iso.toString();
	}

	@NonNull
	private static String stripTrailingZeros(@NonNull String digits) {
		int end = digits.length();

		while (end > 1 && digits.charAt(end - 1) == '0')
			--end;

		return digits.substring(0, end);
	}
}
