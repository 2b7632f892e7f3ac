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

import javax.annotation.concurrent.NotThreadSafe;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Predicate;
import java.util.logging.Level;
import java.util.logging.Logger;

import static java.lang.String.format;
import static java.lang.System.nanoTime;
import static java.util.Objects.requireNonNull;

/**
 * Storage handler for a single table: builds CQL for each operation, runs it on a {@link CqlConnection} and turns the
 * returned text back into {@link Row}s.
 * <p>
 * Reads work through a forward-only cursor over the most recent query's rows:
 * <pre>{@code  CqlTable table = CqlTable.withConnection(connection, schema).build();
 * table.startScan();
 *
 * for (Optional<Row> row = table.next(); row.isPresent(); row = table.next())
 *   positions.add(table.position());}</pre>
 * Positions stay valid until the next query replaces the cursor's rows.
 * <p>
 * Instances are intended for use by a single thread.
 *
 * @since 1.0.0
 */
@NotThreadSafe
public class CqlTable implements AutoCloseable {
	@NonNull
	private static final Set<Capability> CAPABILITIES = Collections.unmodifiableSet(EnumSet.of(Capability.FORWARD_SCAN,
			Capability.POSITIONAL_READ, Capability.KEY_LOOKUP, Capability.FULL_TABLE_SCAN));

	@NonNull
	private final CqlConnection connection;
	@NonNull
	private final TableSchema schema;
	@NonNull
	private final StatementBuilder statementBuilder;
	@NonNull
	private final ResultMaterializer resultMaterializer;
	@NonNull
	private final StatementLogger statementLogger;
	@NonNull
	private final DecodeFailurePolicy decodeFailurePolicy;
	@NonNull
	private final Boolean allowFiltering;
	@NonNull
	private final Integer replicationFactor;
	@NonNull
	private final AtomicInteger defaultIdGenerator;
	@NonNull
	private final Logger logger;

	@Nullable
	private List<Row> rows;
	private int cursor;

	protected CqlTable(@NonNull Builder builder) {
		requireNonNull(builder);

		TypeMapper typeMapper = builder.typeMapper == null ? TypeMapper.withDefaultConfiguration() : builder.typeMapper;

		ConnectionParameters connectionParameters = builder.connectionParameters;
		TableSchema schema = requireNonNull(builder.schema);
		boolean verbose = builder.verbose;

		if (connectionParameters != null) {
			schema = schema.withQualifiedName(connectionParameters.getKeyspace().orElse(schema.getKeyspace()),
					connectionParameters.getTable().orElse(schema.getTable()));
			verbose = verbose || connectionParameters.isVerbose();
		}

		this.connection = requireNonNull(builder.connection);
		this.schema = schema;
		this.statementBuilder = StatementBuilder.withTypeMapper(typeMapper).strictSchema(builder.strictSchema).build();
		this.resultMaterializer = builder.resultMaterializer == null
				? ResultMaterializer.withTypeMapper(typeMapper).build() : builder.resultMaterializer;
		this.decodeFailurePolicy = builder.decodeFailurePolicy == null ? DecodeFailurePolicy.NULL_FILL : builder.decodeFailurePolicy;
		this.allowFiltering = builder.allowFiltering == null ? true : builder.allowFiltering;
		this.replicationFactor = builder.replicationFactor == null ? 1 : builder.replicationFactor;
		this.defaultIdGenerator = new AtomicInteger();
		this.logger = Logger.getLogger(getClass().getName());

		if (builder.statementLogger != null)
			this.statementLogger = builder.statementLogger;
		else
			this.statementLogger = new DefaultStatementLogger(DefaultStatementLogger.DEFAULT_LOGGER_NAME,
					verbose ? DefaultStatementLogger.VERBOSE_LOGGER_LEVEL : DefaultStatementLogger.DEFAULT_LOGGER_LEVEL);
	}

	/**
	 * Provides a {@link CqlTable} builder for the given connection and table.
	 *
	 * @param connection the connection statements run on
	 * @param schema     the table this handler manages
	 * @return a {@link CqlTable} builder
	 */
	@NonNull
	public static Builder withConnection(@NonNull CqlConnection connection,
																			 @NonNull TableSchema schema) {
		requireNonNull(connection);
		requireNonNull(schema);
		return new Builder(connection, schema);
	}

	/**
	 * Creates the keyspace if it does not exist yet, then the table.
	 */
	public void createTable() {
		execute(StatementKind.CREATE_KEYSPACE,
				getStatementBuilder().buildCreateKeyspace(getSchema().getKeyspace(), getReplicationFactor()));
		execute(StatementKind.CREATE_TABLE, getStatementBuilder().buildCreateTable(getSchema()));
	}

	public void dropTable() {
		endScan();
		execute(StatementKind.DROP_TABLE, getStatementBuilder().buildDropTable(getSchema()));
	}

	public void truncate() {
		endScan();
		execute(StatementKind.TRUNCATE, getStatementBuilder().buildTruncate(getSchema()));
	}

	/**
	 * CQL has no table rename, so this always fails.
	 *
	 * @param newTableName the requested new name
	 * @throws UnsupportedFeatureException always
	 */
	public void renameTable(@NonNull String newTableName) {
		requireNonNull(newTableName);
		throw new UnsupportedFeatureException(format("Cannot rename table %s to %s: CQL does not support renaming tables",
				getSchema().getQualifiedName(), newTableName), getSchema().getKeyspace(), getSchema().getTable(), null);
	}

	public void insert(@NonNull Row row) {
		requireNonNull(row);
		execute(StatementKind.INSERT, getStatementBuilder().buildInsert(getSchema(), row));
	}

	/**
	 * Rewrites the non-key columns of the record identified by {@code oldRow}'s primary key.
	 *
	 * @param oldRow the record as it was
	 * @param newRow the record as it should be
	 * @throws UnsupportedFeatureException if {@code newRow} changes a primary-key value
	 */
	public void update(@NonNull Row oldRow,
										 @NonNull Row newRow) {
		requireNonNull(oldRow);
		requireNonNull(newRow);

		for (ColumnDescriptor column : getSchema().getPrimaryKeyColumns()) {
			if (!newRow.contains(column.getName()))
				continue;

			Object oldValue = oldRow.get(column.getName()).orElse(null);
			Object newValue = newRow.get(column.getName()).orElse(null);

			// Compared as encoded literals, the form the WHERE clause uses
			String oldLiteral = getStatementBuilder().getTypeMapper().encode(oldValue, column).orElseThrow();
			String newLiteral = getStatementBuilder().getTypeMapper().encode(newValue, column).orElseThrow();

			if (!Objects.equals(oldLiteral, newLiteral))
				throw new UnsupportedFeatureException(format("Cannot change primary key column %s of table %s from %s to %s",
						column.getName(), getSchema().getQualifiedName(), oldLiteral, newLiteral),
						getSchema().getKeyspace(), getSchema().getTable(), column.getName());
		}

		execute(StatementKind.UPDATE, getStatementBuilder().buildUpdate(getSchema(), oldRow, newRow));
	}

	public void delete(@NonNull Row row) {
		requireNonNull(row);
		execute(StatementKind.DELETE, getStatementBuilder().buildDelete(getSchema(), row));
	}

	/**
	 * Reads the whole table and positions the cursor before its first row.
	 */
	public void startScan() {
		this.rows = query(getStatementBuilder().buildSelect(getSchema(), (String) null, getAllowFiltering()));
		this.cursor = 0;
	}

	/**
	 * Advances the cursor.
	 *
	 * @return the next row, or empty once the rows are exhausted
	 * @throws IllegalStateException if no scan or lookup is active
	 */
	@NonNull
	public Optional<Row> next() {
		List<Row> rows = activeRows();

		if (this.cursor >= rows.size())
			return Optional.empty();

		return Optional.of(rows.get(this.cursor++));
	}

	/**
	 * @return the position of the row most recently returned by {@link #next()}, {@link #lookup(List)} or
	 * {@link #fetch(ScanPosition)}
	 * @throws IllegalStateException if no row has been returned yet
	 */
	@NonNull
	public ScanPosition position() {
		activeRows();

		if (this.cursor == 0)
			throw new IllegalStateException("No row has been read yet");

		return ScanPosition.of(this.cursor - 1);
	}

	/**
	 * Re-reads the row at {@code position} and moves the cursor just past it.
	 *
	 * @param position a position obtained from {@link #position()} since the last query
	 * @return the row at that position
	 * @throws KeyspanException if there is no row at that position
	 */
	@NonNull
	public Row fetch(@NonNull ScanPosition position) {
		requireNonNull(position);

		List<Row> rows = activeRows();

		if (position.getRowIndex() >= rows.size())
			throw new KeyspanException(format("No row at %s, only %d row[s] were read", position, rows.size()));

		int index = (int) position.getRowIndex();
		this.cursor = index + 1;
		return rows.get(index);
	}

	public void endScan() {
		this.rows = null;
		this.cursor = 0;
	}

	@NonNull
	public Optional<Row> lookup(@NonNull List<?> keyParts) {
		requireNonNull(keyParts);
		return lookup(KeyPredicate.fromKeyParts(getSchema(), keyParts));
	}

	/**
	 * Reads the rows matching a prefix of the primary key and returns the first one, leaving the cursor after it.
	 *
	 * @param keyParts   values for the leading key columns
	 * @param keyPartMap bitmap of which key parts are present, bit {@code 0} being the first
	 * @return the first matching row, or empty if none match
	 */
	@NonNull
	public Optional<Row> lookup(@NonNull List<?> keyParts,
															long keyPartMap) {
		requireNonNull(keyParts);
		return lookup(KeyPredicate.fromKeyParts(getSchema(), keyParts, keyPartMap));
	}

	@NonNull
	protected Optional<Row> lookup(@NonNull KeyPredicate keyPredicate) {
		requireNonNull(keyPredicate);

		this.rows = query(getStatementBuilder().buildSelect(getSchema(), keyPredicate, getAllowFiltering()));
		this.cursor = 0;

		return next();
	}

	/**
	 * Rewinds the cursor to the first row of the most recent query.
	 *
	 * @return the first row, or empty if the query returned none
	 */
	@NonNull
	public Optional<Row> first() {
		activeRows();
		this.cursor = 0;
		return next();
	}

	@NonNull
	public Optional<Row> previous() {
		throw new UnsupportedFeatureException("Reading backwards is not supported", getSchema().getKeyspace(),
				getSchema().getTable(), null);
	}

	@NonNull
	public Optional<Row> last() {
		throw new UnsupportedFeatureException("Reading the last row of an index is not supported",
				getSchema().getKeyspace(), getSchema().getTable(), null);
	}

	/**
	 * Serves range and ordered requests, which CQL cannot express for arbitrary columns, by reading the whole table and
	 * filtering here.
	 *
	 * @param predicate which rows to keep
	 * @return the matching rows in the order the cluster returned them
	 */
	@NonNull
	public List<Row> scan(@NonNull Predicate<Row> predicate) {
		requireNonNull(predicate);

		List<Row> matches = new ArrayList<>();

		for (Row row : query(getStatementBuilder().buildSelect(getSchema(), (String) null, getAllowFiltering())))
			if (predicate.test(row))
				matches.add(row);

		return matches;
	}

	@NonNull
	public Set<Capability> getCapabilities() {
		return CAPABILITIES;
	}

	/**
	 * Ends any active scan and closes the underlying connection.
	 */
	@Override
	public void close() {
		endScan();
		getConnection().close();
	}

	@NonNull
	protected List<Row> activeRows() {
		if (this.rows == null)
			throw new IllegalStateException("No scan or lookup is active");

		return this.rows;
	}

	protected void execute(@NonNull StatementKind statementKind,
												 @NonNull String cql) {
		requireNonNull(statementKind);
		requireNonNull(cql);

		performStatement(createStatement(statementKind, cql));
	}

	@NonNull
	protected List<Row> query(@NonNull String cql) {
		requireNonNull(cql);
		return performStatement(createStatement(StatementKind.SELECT, cql));
	}

	@NonNull
	protected Statement createStatement(@NonNull StatementKind statementKind,
																			@NonNull String cql) {
		return Statement.of(format("com.keyspan.%s", this.defaultIdGenerator.incrementAndGet()), statementKind, cql);
	}

	/**
	 * Runs {@code statement}, materializing its rows if it is a query, and reports it to the statement logger.
	 *
	 * @param statement the statement to run
	 * @return the materialized rows, empty for anything other than a query
	 */
	@NonNull
	protected List<Row> performStatement(@NonNull Statement statement) {
		requireNonNull(statement);

		StatementContext statementContext = StatementContext.of(statement, getSchema());
		Duration executionDuration = null;
		Duration materializationDuration = null;
		Integer rowCount = null;
		Exception exception = null;
		Throwable thrown = null;

		try {
			if (!getConnection().isConnected())
				getConnection().connect();

			long startTime = nanoTime();
			ResultSet resultSet = getConnection().execute(statement.getCql());
			executionDuration = Duration.ofNanos(nanoTime() - startTime);

			if (!statement.getKind().isQuery())
				return List.of();

			startTime = nanoTime();
			List<Row> rows = materialize(statementContext, resultSet);
			materializationDuration = Duration.ofNanos(nanoTime() - startTime);
			rowCount = rows.size();

			return rows;
		} catch (KeyspanException e) {
			exception = e;
			thrown = e;
			throw e;
		} catch (Error e) {
			exception = new KeyspanException(e);
			thrown = e;
			throw e;
		} catch (Exception e) {
			exception = e;
			KeyspanException wrapped = new KeyspanException(e);
			thrown = wrapped;
			throw wrapped;
		} finally {
			StatementLog statementLog =
					StatementLog.withStatementContext(statementContext)
							.executionDuration(executionDuration)
							.materializationDuration(materializationDuration)
							.rowCount(rowCount)
							.exception(exception)
							.build();

			try {
				getStatementLogger().log(statementLog);
			} catch (Throwable loggerFailure) {
				if (thrown != null)
					thrown.addSuppressed(loggerFailure);
				else if (loggerFailure instanceof RuntimeException runtimeException)
					throw runtimeException;
				else if (loggerFailure instanceof Error error)
					throw error;
				else
					throw new RuntimeException(loggerFailure);
			}
		}
	}

	@NonNull
	protected List<Row> materialize(@NonNull StatementContext statementContext,
																	@NonNull ResultSet resultSet) {
		requireNonNull(statementContext);
		requireNonNull(resultSet);

		List<Row> rows = new ArrayList<>(resultSet.getRowCount());

		for (ResultRow resultRow : resultSet.getRows()) {
			Materialization materialization =
					getResultMaterializer().materialize(resultSet.getColumnNames(), resultRow, statementContext.getSchema());

			if (materialization.hasFailures()) {
				if (getDecodeFailurePolicy() == DecodeFailurePolicy.FAIL_ROW)
					throw materialization.getFailures().get(0);

				for (TypeConversionException failure : materialization.getFailures())
					logger.log(Level.WARNING, format("Storing NULL in %s.%s: %s", statementContext.getSchema().getQualifiedName(),
							failure.getColumn().orElse("?"), failure.getMessage()));
			}

			rows.add(materialization.getRow());
		}

		return rows;
	}

	@NonNull
	public TableSchema getSchema() {
		return this.schema;
	}

	@NonNull
	protected CqlConnection getConnection() {
		return this.connection;
	}

	@NonNull
	protected StatementBuilder getStatementBuilder() {
		return this.statementBuilder;
	}

	@NonNull
	protected ResultMaterializer getResultMaterializer() {
		return this.resultMaterializer;
	}

	@NonNull
	protected StatementLogger getStatementLogger() {
		return this.statementLogger;
	}

	@NonNull
	public DecodeFailurePolicy getDecodeFailurePolicy() {
		return this.decodeFailurePolicy;
	}

	@NonNull
	public Boolean getAllowFiltering() {
		return this.allowFiltering;
	}

	@NonNull
	public Integer getReplicationFactor() {
		return this.replicationFactor;
	}

	/**
	 * Builder used to construct instances of {@link CqlTable}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @since 1.0.0
	 */
	@NotThreadSafe
	public static class Builder {
		@NonNull
		private final CqlConnection connection;
		@NonNull
		private final TableSchema schema;
		@Nullable
		private TypeMapper typeMapper;
		@Nullable
		private ResultMaterializer resultMaterializer;
		@Nullable
		private StatementLogger statementLogger;
		@Nullable
		private DecodeFailurePolicy decodeFailurePolicy;
		@Nullable
		private Boolean allowFiltering;
		@Nullable
		private Integer replicationFactor;
		@Nullable
		private ConnectionParameters connectionParameters;
		private boolean strictSchema;
		private boolean verbose;

		private Builder(@NonNull CqlConnection connection,
										@NonNull TableSchema schema) {
			this.connection = requireNonNull(connection);
			this.schema = requireNonNull(schema);
		}

		/**
		 * Type mapper used both to encode statement literals and, unless {@link #resultMaterializer(ResultMaterializer)}
		 * is set, to decode returned cells.
		 */
		@NonNull
		public Builder typeMapper(@Nullable TypeMapper typeMapper) {
			this.typeMapper = typeMapper;
			return this;
		}

		@NonNull
		public Builder resultMaterializer(@Nullable ResultMaterializer resultMaterializer) {
			this.resultMaterializer = resultMaterializer;
			return this;
		}

		@NonNull
		public Builder statementLogger(@Nullable StatementLogger statementLogger) {
			this.statementLogger = statementLogger;
			return this;
		}

		@NonNull
		public Builder decodeFailurePolicy(@Nullable DecodeFailurePolicy decodeFailurePolicy) {
			this.decodeFailurePolicy = decodeFailurePolicy;
			return this;
		}

		/**
		 * Whether generated {@code SELECT}s end with {@code ALLOW FILTERING}. Defaults to {@code true}.
		 */
		@NonNull
		public Builder allowFiltering(@Nullable Boolean allowFiltering) {
			this.allowFiltering = allowFiltering;
			return this;
		}

		@NonNull
		public Builder replicationFactor(@Nullable Integer replicationFactor) {
			if (replicationFactor != null && replicationFactor < 1)
				throw new IllegalArgumentException(format("Replication factor must be at least 1, was %d", replicationFactor));

			this.replicationFactor = replicationFactor;
			return this;
		}

		@NonNull
		public Builder strictSchema(boolean strictSchema) {
			this.strictSchema = strictSchema;
			return this;
		}

		/**
		 * Logs statements at {@code INFO} instead of {@code FINE}. Ignored when a custom statement logger is set.
		 */
		@NonNull
		public Builder verbose(boolean verbose) {
			this.verbose = verbose;
			return this;
		}

		/**
		 * Applies per-table settings: a {@code keyspace} or {@code table} present in {@code connectionParameters}
		 * replaces the schema's, and {@code verbose} raises statement logging to {@code INFO} as
		 * {@link #verbose(boolean)} does.
		 */
		@NonNull
		public Builder connectionParameters(@Nullable ConnectionParameters connectionParameters) {
			this.connectionParameters = connectionParameters;
			return this;
		}

		@NonNull
		public CqlTable build() {
			return new CqlTable(this);
		}
	}
}
