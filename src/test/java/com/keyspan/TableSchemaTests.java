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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * @since 1.0.0
 */
public class TableSchemaTests {
	@Test
	public void testColumnNamesAreUniqueIgnoringCase() {
		Assertions.assertThrows(IllegalArgumentException.class, () -> TableSchema.with("ks", "t")
				.column("Name", LogicalType.TEXT)
				.column("NAME", LogicalType.INT)
				.build());
	}

	@Test
	public void testClusteringKeyRequiresPartitionKey() {
		Assertions.assertThrows(IllegalArgumentException.class, () -> TableSchema.with("ks", "t")
				.column(ColumnDescriptor.withName("day", LogicalType.DATE).clusteringKey().build())
				.build());
	}

	@Test
	public void testFirstColumnIsKeyWhenNoneIsMarked() {
		TableSchema schema = TableSchema.of("ks", "t", List.of(
				ColumnDescriptor.of("code", LogicalType.TEXT),
				ColumnDescriptor.of("amount", LogicalType.DECIMAL)));

		Assertions.assertEquals(List.of("code"), schema.getPrimaryKeyColumns().stream().map(ColumnDescriptor::getName).collect(Collectors.toList()));
		Assertions.assertEquals(List.of("amount"), schema.getRegularColumns().stream().map(ColumnDescriptor::getName).collect(Collectors.toList()));
		Assertions.assertTrue(TableSchema.with("ks", "empty").build().getPrimaryKeyColumns().isEmpty());
	}

	@Test
	public void testKeyOrderIsPartitionThenClustering() {
		TableSchema schema = TableSchema.with("ks", "events")
				.column(ColumnDescriptor.withName("day", LogicalType.DATE).clusteringKey().build())
				.column("note", LogicalType.TEXT)
				.column(ColumnDescriptor.withName("tenant", LogicalType.TEXT).partitionKey().build())
				.build();

		Assertions.assertEquals(List.of("tenant", "day"),
				schema.getPrimaryKeyColumns().stream().map(ColumnDescriptor::getName).collect(Collectors.toList()));
		Assertions.assertEquals("ks.events", schema.getQualifiedName());
		Assertions.assertTrue(schema.getColumn("TENANT").isPresent());
		Assertions.assertFalse(schema.getColumn("ID").isPresent());
	}

	@Test
	public void testKeyColumnsAreNotNullableByDefault() {
		Assertions.assertFalse(ColumnDescriptor.withName("id", LogicalType.INT).partitionKey().build().isNullable());
		Assertions.assertTrue(ColumnDescriptor.of("note", LogicalType.TEXT).isNullable());
		Assertions.assertThrows(IllegalArgumentException.class, () -> ColumnDescriptor.withName("price", LogicalType.DECIMAL).scale(-1).build());
	}

	@Test
	public void testRowDistinguishesAbsentFromNull() {
		Row row = Row.builder().value("id", 1).nullValue("Name").build();

		Assertions.assertTrue(row.contains("name"));
		Assertions.assertTrue(row.isNull("NAME"));
		Assertions.assertFalse(row.contains("note"));
		Assertions.assertFalse(row.isNull("note"), "Absent is not the same as null");
		Assertions.assertEquals(List.of("id", "Name"), row.getColumnNames());
		Assertions.assertNotEquals(Row.of(Map.of("id", 1)), row, "A null cell is still part of the row");
	}

	@Test
	public void testRowCopiesBlobs() {
		byte[] payload = {1, 2, 3};
		Row row = Row.builder().value("payload", payload).build();

		payload[0] = 9;
		Assertions.assertArrayEquals(new byte[]{1, 2, 3}, (byte[]) row.get("payload").orElseThrow(),
				"Changing the source array must not change the row");

		((byte[]) row.get("payload").orElseThrow())[1] = 9;
		Assertions.assertArrayEquals(new byte[]{1, 2, 3}, (byte[]) row.get("payload").orElseThrow(),
				"Changing a returned array must not change the row");
	}

	@Test
	public void testWithQualifiedNameKeepsColumnsAndKeys() {
		TableSchema schema = TableSchema.with("ks", "t")
				.column(ColumnDescriptor.withName("tenant", LogicalType.TEXT).partitionKey().build())
				.column(ColumnDescriptor.withName("id", LogicalType.BIGINT).clusteringKey().build())
				.build();

		TableSchema renamed = schema.withQualifiedName("a", "b");

		Assertions.assertEquals("a.b", renamed.getQualifiedName());
		Assertions.assertEquals(schema.getColumns(), renamed.getColumns());
		Assertions.assertEquals(schema.getPrimaryKeyColumns(), renamed.getPrimaryKeyColumns());
		Assertions.assertSame(schema, schema.withQualifiedName("ks", "t"), "Unchanged names return the same schema");
	}
}
