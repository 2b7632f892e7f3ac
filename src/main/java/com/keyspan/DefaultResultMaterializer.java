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
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Basic implementation of {@link ResultMaterializer}.
 *
 * @since 1.0.0
 */
@ThreadSafe
class DefaultResultMaterializer implements ResultMaterializer {
	@NonNull
	private final TypeMapper typeMapper;
	@NonNull
	private final Locale normalizationLocale;

	DefaultResultMaterializer(ResultMaterializer.@NonNull Builder builder) {
		requireNonNull(builder);

		this.typeMapper = requireNonNull(builder.typeMapper);
		this.normalizationLocale = requireNonNull(builder.normalizationLocale);
	}

	@Override
	@NonNull
	public Materialization materialize(@NonNull List<String> columnNames,
																		 @NonNull ResultRow row,
																		 @NonNull TableSchema schema) {
		requireNonNull(columnNames);
		requireNonNull(row);
		requireNonNull(schema);

		if (row.size() != columnNames.size())
			throw new IllegalArgumentException(format("Row has %d cell[s] but there are %d column name[s]",
					row.size(), columnNames.size()));

		Map<String, Integer> positionsByNormalizedName = new HashMap<>(columnNames.size());

		for (int i = 0; i < columnNames.size(); ++i) {
			String columnName = requireNonNull(columnNames.get(i));

			if (positionsByNormalizedName.put(normalizeColumnName(columnName), i) != null)
				throw new KeyspanException(format("Result for table %s has more than one column named '%s' (ignoring case)",
						schema.getQualifiedName(), columnName));
		}

		Row.Builder rowBuilder = Row.builder();
		List<TypeConversionException> failures = new ArrayList<>();

		for (ColumnDescriptor column : schema.getColumns()) {
			Integer position = positionsByNormalizedName.get(normalizeColumnName(column.getName()));

			if (position == null) {
				rowBuilder.nullValue(column.getName());
				continue;
			}

			ConversionResult<Object> conversionResult = getTypeMapper().decode(row.getCell(position), column);

			if (conversionResult.isSuccess()) {
				rowBuilder.value(column.getName(), conversionResult.getValue().orElse(null));
			} else {
				rowBuilder.nullValue(column.getName());
				failures.add(conversionResult.getFailure().get());
			}
		}

		return Materialization.of(rowBuilder.build(), failures);
	}

	/**
	 * Massages a column name so it can be compared against others ignoring case.
	 * <p>
	 * This implementation lowercases the name using the locale provided by {@link #getNormalizationLocale()}.
	 *
	 * @param columnName the column name to massage
	 * @return the normalized column name
	 */
	@NonNull
	protected String normalizeColumnName(@NonNull String columnName) {
		requireNonNull(columnName);
		return columnName.toLowerCase(getNormalizationLocale());
	}

	@NonNull
	protected TypeMapper getTypeMapper() {
		return this.typeMapper;
	}

	@NonNull
	protected Locale getNormalizationLocale() {
		return this.normalizationLocale;
	}
}
