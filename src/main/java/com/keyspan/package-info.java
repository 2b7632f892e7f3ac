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

/**
 * Keyspan translates relational rows to and from CQL so a row-oriented storage layer can keep its data in a
 * Cassandra-compatible cluster.
 *
 * <pre>
 * // Describe the table
 * TableSchema schema = TableSchema.with("ks", "t")
 *   .column(ColumnDescriptor.withName("id", LogicalType.INT).partitionKey().build())
 *   .column("name", LogicalType.TEXT)
 *   .build();
 *
 * // Connect lazily and manage the table
 * CqlConnection connection = new DriverCqlConnection(ConnectionParameters.parse("hosts=10.0.0.1,10.0.0.2;port=9042"));
 * CqlTable table = CqlTable.withConnection(connection, schema).build();
 * table.createTable();
 *
 * // Write
 * table.insert(Row.builder().value("id", 7).value("name", "O'Brien").build());
 *
 * // Read
 * Optional&lt;Row&gt; row = table.lookup(List.of(7));
 * List&lt;Row&gt; longNames = table.scan(r -&gt; r.get("name", String.class).map(n -&gt; n.length() &gt; 5).orElse(false));</pre>
 *
 * @since 1.0.0
 */
package com.keyspan;
