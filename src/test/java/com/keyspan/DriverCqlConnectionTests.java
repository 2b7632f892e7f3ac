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

import com.datastax.oss.driver.api.core.CqlIdentifier;
import com.datastax.oss.driver.api.core.CqlSession;
import com.datastax.oss.driver.api.core.DriverTimeoutException;
import com.datastax.oss.driver.api.core.NoNodeAvailableException;
import com.datastax.oss.driver.api.core.cql.ColumnDefinition;
import com.datastax.oss.driver.api.core.cql.ColumnDefinitions;
import org.jspecify.annotations.NonNull;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * @since 1.0.0
 */
public class DriverCqlConnectionTests {
	@Test
	public void testRowsAreRenderedAsText() {
		CqlSession session = mock(CqlSession.class);
		com.datastax.oss.driver.api.core.cql.ResultSet driverResultSet = resultSet(List.of("Id", "name"),
				List.of(row(42, "Bob"), row(7, null)));
		when(session.execute("SELECT * FROM ks.t")).thenReturn(driverResultSet);

		ResultSet resultSet = new SessionCqlConnection(session).execute("SELECT * FROM ks.t");

		Assertions.assertEquals(List.of("Id", "name"), resultSet.getColumnNames(), "Names are passed through unquoted");
		Assertions.assertEquals(2, resultSet.getRows().size());
		Assertions.assertEquals(List.of("42", "Bob"), resultSet.getRows().get(0).getCells());
		Assertions.assertEquals(List.of("7", "NULL"), resultSet.getRows().get(1).getCells(), "Null cells become NULL");
	}

	@Test
	public void testStatementsWithoutColumnsYieldEmptyResult() {
		CqlSession session = mock(CqlSession.class);
		com.datastax.oss.driver.api.core.cql.ResultSet driverResultSet = resultSet(List.of(), List.of());
		when(session.execute("TRUNCATE ks.t")).thenReturn(driverResultSet);

		SessionCqlConnection connection = new SessionCqlConnection(session);
		ResultSet resultSet = connection.execute("TRUNCATE ks.t");

		Assertions.assertTrue(resultSet.getColumnNames().isEmpty());
		Assertions.assertTrue(resultSet.getRows().isEmpty());
		Assertions.assertEquals(1, connection.getSessionCount(), "The first statement connects");
		verify(session).execute("TRUNCATE ks.t");
	}

	@Test
	public void testNoAvailableNodeIsConnectionFailure() {
		CqlSession session = mock(CqlSession.class);
		when(session.execute(anyString())).thenThrow(new NoNodeAvailableException());

		Assertions.assertThrows(ConnectionException.class,
				() -> new SessionCqlConnection(session).execute("SELECT * FROM ks.t"));
	}

	@Test
	public void testDriverFailureCarriesStatement() {
		CqlSession session = mock(CqlSession.class);
		when(session.execute(anyString())).thenThrow(new DriverTimeoutException("Query timed out after PT2S"));

		StatementExecutionException exception = Assertions.assertThrows(StatementExecutionException.class,
				() -> new SessionCqlConnection(session).execute("SELECT * FROM ks.t"));

		Assertions.assertEquals("SELECT * FROM ks.t", exception.getCql().orElse(null));
		Assertions.assertInstanceOf(DriverTimeoutException.class, exception.getCause());
	}

	private static com.datastax.oss.driver.api.core.cql.@NonNull ResultSet resultSet(@NonNull List<String> columnNames,
																																					@NonNull List<com.datastax.oss.driver.api.core.cql.Row> rows) {
		List<ColumnDefinition> definitions = columnNames.stream().map(columnName -> {
			ColumnDefinition definition = mock(ColumnDefinition.class);
			when(definition.getName()).thenReturn(CqlIdentifier.fromInternal(columnName));
			return definition;
		}).collect(Collectors.toList());

		ColumnDefinitions columnDefinitions = mock(ColumnDefinitions.class);
		when(columnDefinitions.size()).thenReturn(definitions.size());
		when(columnDefinitions.iterator()).thenAnswer(invocation -> definitions.iterator());

		com.datastax.oss.driver.api.core.cql.ResultSet driverResultSet = mock(com.datastax.oss.driver.api.core.cql.ResultSet.class);
		when(driverResultSet.getColumnDefinitions()).thenReturn(columnDefinitions);
		when(driverResultSet.iterator()).thenAnswer(invocation -> rows.iterator());
		return driverResultSet;
	}

	private static com.datastax.oss.driver.api.core.cql.@NonNull Row row(Object... values) {
		com.datastax.oss.driver.api.core.cql.Row row = mock(com.datastax.oss.driver.api.core.cql.Row.class);

		for (int i = 0; i < values.length; ++i) {
			when(row.isNull(i)).thenReturn(values[i] == null);
			when(row.getObject(i)).thenReturn(values[i]);
		}

		return row;
	}

	static class SessionCqlConnection extends DriverCqlConnection {
		@NonNull
		private final CqlSession session;
		private int sessionCount;

		SessionCqlConnection(@NonNull CqlSession session) {
			super(ConnectionParameters.parse("hosts=127.0.0.1"));
			this.session = session;
		}

		@NonNull
		@Override
		protected CqlSession createSession(@NonNull ConnectionParameters connectionParameters) {
			++this.sessionCount;
			return this.session;
		}

		int getSessionCount() {
			return this.sessionCount;
		}
	}
}
