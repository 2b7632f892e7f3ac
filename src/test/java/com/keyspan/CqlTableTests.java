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
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.NotThreadSafe;
import java.math.BigDecimal;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.logging.Level;

import static java.util.Objects.requireNonNull;

/**
 * @since 1.0.0
 */
public class CqlTableTests {
	private final TableSchema schema = TableSchema.with("ks", "t")
			.column(ColumnDescriptor.withName("id", LogicalType.INT).partitionKey().build())
			.column("name", LogicalType.TEXT)
			.build();

	@Test
	public void testCreateTableConnectsLazilyAndBootstrapsKeyspace() {
		RecordingCqlConnection connection = new RecordingCqlConnection();
		CqlTable table = CqlTable.withConnection(connection, schema).replicationFactor(3).build();

		Assertions.assertFalse(connection.isConnected(), "Building a table must not connect");

		table.createTable();

		Assertions.assertTrue(connection.isConnected());
		Assertions.assertEquals(1, connection.getConnectCount());
		Assertions.assertEquals(List.of(
				"CREATE KEYSPACE IF NOT EXISTS ks WITH replication = {'class': 'SimpleStrategy', 'replication_factor': 3}",
				"CREATE TABLE IF NOT EXISTS ks.t (id int, name text, PRIMARY KEY (id))"), connection.getExecutedCql());
	}

	@Test
	public void testReconnectsAfterClose() {
		RecordingCqlConnection connection = new RecordingCqlConnection();
		CqlTable table = CqlTable.withConnection(connection, schema).build();

		table.truncate();
		connection.close();
		table.dropTable();

		Assertions.assertEquals(2, connection.getConnectCount());
		Assertions.assertEquals(List.of("TRUNCATE ks.t", "DROP TABLE IF EXISTS ks.t"), connection.getExecutedCql());
	}

	@Test
	public void testWrites() {
		RecordingCqlConnection connection = new RecordingCqlConnection();
		CqlTable table = CqlTable.withConnection(connection, schema).build();

		Row oldRow = Row.builder().value("id", 7).value("name", "A").build();
		Row newRow = Row.builder().value("id", 7).value("name", "B").build();

		table.insert(Row.builder().value("id", 7).value("name", "O'Brien").build());
		table.update(oldRow, newRow);
		table.delete(newRow);

		Assertions.assertEquals(List.of(
				"INSERT INTO ks.t (id, name) VALUES (7, 'O''Brien')",
				"UPDATE ks.t SET name = 'B' WHERE id = 7",
				"DELETE FROM ks.t WHERE id = 7"), connection.getExecutedCql());
	}

	@Test
	public void testPrimaryKeyChangeIsUnsupported() {
		RecordingCqlConnection connection = new RecordingCqlConnection();
		CqlTable table = CqlTable.withConnection(connection, schema).build();

		Row oldRow = Row.builder().value("id", 7).value("name", "A").build();
		Row newRow = Row.builder().value("id", 8).value("name", "A").build();

		UnsupportedFeatureException exception = Assertions.assertThrows(UnsupportedFeatureException.class,
				() -> table.update(oldRow, newRow));

		Assertions.assertEquals("id", exception.getColumn().orElse(null));
		Assertions.assertTrue(connection.getExecutedCql().isEmpty(), "Nothing should be sent for a rejected update");
	}

	@Test
	public void testUpdateAcceptsEquivalentKeyValues() {
		TableSchema accounts = TableSchema.with("ks", "accounts")
				.column(ColumnDescriptor.withName("id", LogicalType.BIGINT).partitionKey().build())
				.column(ColumnDescriptor.withName("code", LogicalType.DECIMAL).scale(2).clusteringKey().build())
				.column("name", LogicalType.TEXT)
				.build();

		RecordingCqlConnection connection = new RecordingCqlConnection();
		CqlTable table = CqlTable.withConnection(connection, accounts).build();

		Row oldRow = Row.builder().value("id", 7L).value("code", new BigDecimal("1.50")).value("name", "A").build();
		Row newRow = Row.builder().value("id", 7).value("code", new BigDecimal("1.5")).value("name", "B").build();

		table.update(oldRow, newRow);

		Assertions.assertEquals(List.of("UPDATE ks.accounts SET name = 'B' WHERE id = 7 AND code = 1.50"),
				connection.getExecutedCql(), "Boxing and decimal scale differences are not key changes");
	}

	@Test
	public void testConnectionParametersOverrideNameAndVerbosity() {
		RecordingCqlConnection connection = new RecordingCqlConnection();
		CqlTable table = CqlTable.withConnection(connection, schema)
				.connectionParameters(ConnectionParameters.parse("keyspace=a;table=b;verbose=yes"))
				.build();

		table.truncate();

		Assertions.assertEquals("a.b", table.getSchema().getQualifiedName());
		Assertions.assertEquals(List.of("TRUNCATE a.b"), connection.getExecutedCql());
		Assertions.assertEquals(Level.INFO, ((DefaultStatementLogger) table.getStatementLogger()).getLoggerLevel());
	}

	@Test
	public void testConnectionParametersWithoutOverridesKeepSchema() {
		CqlTable table = CqlTable.withConnection(new RecordingCqlConnection(), schema)
				.connectionParameters(ConnectionParameters.parse("hosts=10.0.0.1"))
				.build();

		Assertions.assertSame(schema, table.getSchema());
		Assertions.assertEquals(Level.FINE, ((DefaultStatementLogger) table.getStatementLogger()).getLoggerLevel());
	}

	@Test
	public void testRenameAndReverseReadsAreUnsupported() {
		CqlTable table = CqlTable.withConnection(new RecordingCqlConnection(), schema).build();

		Assertions.assertThrows(UnsupportedFeatureException.class, () -> table.renameTable("t2"));
		Assertions.assertThrows(UnsupportedFeatureException.class, table::previous);
		Assertions.assertThrows(UnsupportedFeatureException.class, table::last);
	}

	@Test
	public void testScanCursorAndPositions() {
		RecordingCqlConnection connection = new RecordingCqlConnection();
		connection.enqueue(ResultSet.of(List.of("name", "id"), List.of(
				ResultRow.of("a", "1"),
				ResultRow.of("b", "2"),
				ResultRow.of("c", "3"))));

		CqlTable table = CqlTable.withConnection(connection, schema).build();
		table.startScan();

		Assertions.assertEquals("SELECT id, name FROM ks.t ALLOW FILTERING", connection.getExecutedCql().get(0));
		Assertions.assertThrows(IllegalStateException.class, table::position, "No row read yet");

		List<ScanPosition> positions = new ArrayList<>();
		List<Object> ids = new ArrayList<>();

		for (Optional<Row> row = table.next(); row.isPresent(); row = table.next()) {
			positions.add(table.position());
			ids.add(row.get().get("id").orElse(null));
		}

		Assertions.assertEquals(List.of(1, 2, 3), ids);
		Assertions.assertEquals(3, positions.size());

		Row second = table.fetch(ScanPosition.fromBytes(positions.get(1).toBytes()));
		Assertions.assertEquals("b", second.get("name").orElse(null));
		Assertions.assertEquals(positions.get(1), table.position());
		Assertions.assertEquals("c", table.next().flatMap(row -> row.get("name")).orElse(null), "Cursor continues after a fetch");

		Assertions.assertThrows(KeyspanException.class, () -> table.fetch(ScanPosition.of(3)));

		table.endScan();
		Assertions.assertThrows(IllegalStateException.class, table::next);
	}

	@Test
	public void testLookupAndFirst() {
		TableSchema events = TableSchema.with("ks", "events")
				.column(ColumnDescriptor.withName("tenant", LogicalType.TEXT).partitionKey().build())
				.column(ColumnDescriptor.withName("id", LogicalType.BIGINT).clusteringKey().build())
				.column("note", LogicalType.TEXT)
				.build();

		RecordingCqlConnection connection = new RecordingCqlConnection();
		connection.enqueue(ResultSet.of(List.of("tenant", "id", "note"), List.of(
				ResultRow.of("acme", "1", "first"),
				ResultRow.of("acme", "2", "second"))));

		CqlTable table = CqlTable.withConnection(connection, events).allowFiltering(false).build();

		Optional<Row> row = table.lookup(List.of("acme", 99L), 0b01);

		Assertions.assertEquals("SELECT tenant, id, note FROM ks.events WHERE tenant = 'acme'", connection.getExecutedCql().get(0));
		Assertions.assertEquals("first", row.flatMap(r -> r.get("note")).orElse(null));
		Assertions.assertEquals(ScanPosition.of(0), table.position());
		Assertions.assertEquals(2L, table.next().flatMap(r -> r.get("id")).orElse(null));
		Assertions.assertTrue(table.next().isEmpty());
		Assertions.assertEquals("first", table.first().flatMap(r -> r.get("note")).orElse(null));

		Assertions.assertTrue(table.lookup(List.of("nobody")).isEmpty(), "No canned rows left, so nothing matches");
		Assertions.assertEquals("SELECT tenant, id, note FROM ks.events WHERE tenant = 'nobody'", connection.getExecutedCql().get(1));
	}

	@Test
	public void testScanWithPredicate() {
		RecordingCqlConnection connection = new RecordingCqlConnection();
		connection.enqueue(ResultSet.of(List.of("id", "name"), List.of(
				ResultRow.of("1", "Al"),
				ResultRow.of("2", "Beatrice"),
				ResultRow.of("3", "Cornelius"))));

		CqlTable table = CqlTable.withConnection(connection, schema).build();

		List<Row> longNames = table.scan(row -> row.get("name", String.class).map(name -> name.length() > 5).orElse(false));

		Assertions.assertEquals(2, longNames.size());
		Assertions.assertEquals(2, longNames.get(0).get("id").orElse(null));
	}

	@Test
	public void testCapabilities() {
		CqlTable table = CqlTable.withConnection(new RecordingCqlConnection(), schema).build();

		Assertions.assertEquals(EnumSet.of(Capability.FORWARD_SCAN, Capability.POSITIONAL_READ, Capability.KEY_LOOKUP,
				Capability.FULL_TABLE_SCAN), table.getCapabilities());
		Assertions.assertFalse(table.getCapabilities().contains(Capability.RANGE_SCAN));
		Assertions.assertFalse(table.getCapabilities().contains(Capability.REVERSE_SCAN));
	}

	@Test
	public void testNullFillPolicy() {
		RecordingCqlConnection connection = new RecordingCqlConnection();
		connection.enqueue(ResultSet.of(List.of("id", "name"), List.of(ResultRow.of("not-a-number", "x"))));

		CqlTable table = CqlTable.withConnection(connection, schema).build();
		table.startScan();

		Row row = table.next().orElseThrow();
		Assertions.assertTrue(row.isNull("id"));
		Assertions.assertEquals("x", row.get("name").orElse(null));
	}

	@Test
	public void testFailRowPolicy() {
		RecordingCqlConnection connection = new RecordingCqlConnection();
		connection.enqueue(ResultSet.of(List.of("id", "name"), List.of(ResultRow.of("not-a-number", "x"))));

		List<StatementLog> statementLogs = new ArrayList<>();
		CqlTable table = CqlTable.withConnection(connection, schema)
				.decodeFailurePolicy(DecodeFailurePolicy.FAIL_ROW)
				.statementLogger(statementLogs::add)
				.build();

		TypeConversionException exception = Assertions.assertThrows(TypeConversionException.class, table::startScan);

		Assertions.assertEquals(TypeConversionException.Kind.MALFORMED, exception.getKind());
		Assertions.assertEquals(1, statementLogs.size());
		Assertions.assertSame(exception, statementLogs.get(0).getException().orElse(null));
	}

	@Test
	public void testStatementLogs() {
		RecordingCqlConnection connection = new RecordingCqlConnection();
		connection.enqueue(ResultSet.of(List.of("id", "name"), List.of(ResultRow.of("1", "a"), ResultRow.of("2", "b"))));

		List<StatementLog> statementLogs = new ArrayList<>();
		CqlTable table = CqlTable.withConnection(connection, schema).statementLogger(statementLogs::add).build();

		table.insert(Row.builder().value("id", 1).value("name", "a").build());
		table.startScan();

		Assertions.assertEquals(2, statementLogs.size());

		StatementLog insertLog = statementLogs.get(0);
		Assertions.assertEquals(StatementKind.INSERT, insertLog.getStatementContext().getStatement().getKind());
		Assertions.assertTrue(insertLog.getExecutionDuration().isPresent());
		Assertions.assertTrue(insertLog.getRowCount().isEmpty(), "Writes have no row count");

		StatementLog selectLog = statementLogs.get(1);
		Assertions.assertEquals(StatementKind.SELECT, selectLog.getStatementContext().getStatement().getKind());
		Assertions.assertEquals(2, selectLog.getRowCount().orElse(null));
		Assertions.assertTrue(selectLog.getMaterializationDuration().isPresent());
		Assertions.assertNotEquals(insertLog.getStatementContext().getStatement().getId(),
				selectLog.getStatementContext().getStatement().getId());
		Assertions.assertEquals("t", selectLog.getStatementContext().getTable());
	}

	@Test
	public void testStatementLoggerExceptionSuppressedWhenOperationFails() {
		RuntimeException loggerFailure = new RuntimeException("logger failed");
		RecordingCqlConnection connection = new RecordingCqlConnection();
		connection.failWith(new StatementExecutionException("unconfigured table t", "TRUNCATE ks.t", null));

		CqlTable table = CqlTable.withConnection(connection, schema)
				.statementLogger(statementLog -> {
					throw loggerFailure;
				})
				.build();

		StatementExecutionException exception = Assertions.assertThrows(StatementExecutionException.class, table::truncate);

		Assertions.assertEquals("TRUNCATE ks.t", exception.getCql().orElse(null));
		Assertions.assertTrue(
				Arrays.stream(exception.getSuppressed()).anyMatch(suppressed -> "logger failed".equals(suppressed.getMessage())),
				"Expected statement logger failure to be suppressed");
	}

	@Test
	public void testStatementLoggerExceptionRethrownWhenOperationSucceeds() {
		RuntimeException loggerFailure = new RuntimeException("logger failed");
		CqlTable table = CqlTable.withConnection(new RecordingCqlConnection(), schema)
				.statementLogger(statementLog -> {
					throw loggerFailure;
				})
				.build();

		RuntimeException exception = Assertions.assertThrows(RuntimeException.class, table::truncate);
		Assertions.assertSame(loggerFailure, exception);
	}

	@Test
	public void testConnectionFailurePropagates() {
		RecordingCqlConnection connection = new RecordingCqlConnection();
		connection.refuseConnections();

		CqlTable table = CqlTable.withConnection(connection, schema).build();

		Assertions.assertThrows(ConnectionException.class, table::createTable);
		Assertions.assertTrue(connection.getExecutedCql().isEmpty());
	}

	@Test
	public void testInvalidReplicationFactor() {
		Assertions.assertThrows(IllegalArgumentException.class,
				() -> CqlTable.withConnection(new RecordingCqlConnection(), schema).replicationFactor(0));
	}

	/**
	 * Records every statement and answers queries from a queue of canned result sets.
	 */
	@NotThreadSafe
	static class RecordingCqlConnection implements CqlConnection {
		private final List<String> executedCql = new ArrayList<>();
		private final Deque<ResultSet> resultSets = new ArrayDeque<>();
		private KeyspanException failure;
		private boolean refuseConnections;
		private boolean connected;
		private int connectCount;

		void enqueue(@NonNull ResultSet resultSet) {
			this.resultSets.add(requireNonNull(resultSet));
		}

		void failWith(@NonNull KeyspanException failure) {
			this.failure = requireNonNull(failure);
		}

		void refuseConnections() {
			this.refuseConnections = true;
		}

		@Override
		public boolean isConnected() {
			return this.connected;
		}

		@Override
		public void connect() {
			if (this.refuseConnections)
				throw new ConnectionException("Connection refused: 127.0.0.1:9042");

			this.connected = true;
			++this.connectCount;
		}

		@NonNull
		@Override
		public ResultSet execute(@NonNull String cql) {
			requireNonNull(cql);

			if (!this.connected)
				throw new ConnectionException("Not connected");

			this.executedCql.add(cql);

			if (this.failure != null)
				throw this.failure;

			if (cql.startsWith("SELECT") && !this.resultSets.isEmpty())
				return this.resultSets.removeFirst();

			return ResultSet.empty();
		}

		@Override
		public void close() {
			this.connected = false;
		}

		@NonNull
		List<String> getExecutedCql() {
			return this.executedCql;
		}

		int getConnectCount() {
			return this.connectCount;
		}
	}
}
