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

import com.datastax.oss.driver.api.core.AllNodesFailedException;
import com.datastax.oss.driver.api.core.CqlSession;
import com.datastax.oss.driver.api.core.CqlSessionBuilder;
import com.datastax.oss.driver.api.core.DriverException;
import com.datastax.oss.driver.api.core.config.DefaultDriverOption;
import com.datastax.oss.driver.api.core.config.DriverConfigLoader;
import com.datastax.oss.driver.api.core.cql.ColumnDefinition;
import com.datastax.oss.driver.api.core.cql.ColumnDefinitions;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.GuardedBy;
import javax.annotation.concurrent.ThreadSafe;
import java.net.InetSocketAddress;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Logger;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;
import static java.util.logging.Level.FINE;
import static java.util.logging.Level.WARNING;

/**
 * {@link CqlConnection} backed by a DataStax Java driver {@link CqlSession}.
 * <p>
 * Sessions speak native protocol V4 with the connect and request timeouts from {@link ConnectionParameters}. Every
 * returned cell is rendered to text by a {@link DriverValueFormatter}.
 *
 * @since 1.0.0
 */
@ThreadSafe
public class DriverCqlConnection implements CqlConnection {
	@NonNull
	private static final String PROTOCOL_VERSION = "V4";

	@NonNull
	private final ConnectionParameters connectionParameters;
	@NonNull
	private final DriverValueFormatter valueFormatter;
	@NonNull
	private final ReentrantLock lock;
	@NonNull
	private final Logger logger;

	@Nullable
	@GuardedBy("lock")
	private volatile CqlSession session;

	public DriverCqlConnection(@NonNull ConnectionParameters connectionParameters) {
		this(connectionParameters, new DriverValueFormatter());
	}

	public DriverCqlConnection(@NonNull ConnectionParameters connectionParameters,
														 @NonNull DriverValueFormatter valueFormatter) {
		requireNonNull(connectionParameters);
		requireNonNull(valueFormatter);

		this.connectionParameters = connectionParameters;
		this.valueFormatter = valueFormatter;
		this.lock = new ReentrantLock();
		this.logger = Logger.getLogger(getClass().getName());
	}

	@Override
	public boolean isConnected() {
		CqlSession session = this.session;
		return session != null && !session.isClosed();
	}

	@Override
	public void connect() {
		getLock().lock();

		try {
			if (isConnected())
				return;

			ConnectionParameters connectionParameters = getConnectionParameters();

			if (logger.isLoggable(FINE))
				logger.log(FINE, format("Connecting to %s on port %d (local datacenter %s)...",
						connectionParameters.getHosts(), connectionParameters.getPort(), connectionParameters.getDatacenter()));

			try {
				this.session = createSession(connectionParameters);
			} catch (DriverException e) {
				throw new ConnectionException(format("Unable to connect to %s on port %d",
						connectionParameters.getHosts(), connectionParameters.getPort()), e);
			}

			logger.log(FINE, "Connected.");
		} finally {
			getLock().unlock();
		}
	}

	@Override
	@NonNull
	public ResultSet execute(@NonNull String cql) {
		requireNonNull(cql);

		if (!isConnected())
			connect();

		CqlSession session = requireNonNull(this.session);

		try {
			com.datastax.oss.driver.api.core.cql.ResultSet driverResultSet = session.execute(cql);
			ColumnDefinitions columnDefinitions = driverResultSet.getColumnDefinitions();

			if (columnDefinitions.size() == 0)
				return ResultSet.empty();

			List<String> columnNames = new ArrayList<>(columnDefinitions.size());

			for (ColumnDefinition columnDefinition : columnDefinitions)
				columnNames.add(columnDefinition.getName().asInternal());

			List<ResultRow> rows = new ArrayList<>();

			for (com.datastax.oss.driver.api.core.cql.Row driverRow : driverResultSet) {
				List<String> cells = new ArrayList<>(columnNames.size());

				for (int i = 0; i < columnNames.size(); ++i)
					cells.add(driverRow.isNull(i) ? DefaultTypeMapper.NULL_LITERAL : getValueFormatter().format(driverRow.getObject(i)));

				rows.add(ResultRow.of(cells));
			}

			return ResultSet.of(columnNames, rows);
		} catch (AllNodesFailedException e) {
			throw new ConnectionException(format("No node could execute statement: %s", e.getMessage()), e);
		} catch (DriverException e) {
			throw new StatementExecutionException(e.getMessage(), cql, e);
		}
	}

	@Override
	public void close() {
		getLock().lock();

		try {
			CqlSession session = this.session;
			this.session = null;

			if (session != null && !session.isClosed()) {
				try {
					session.close();
				} catch (RuntimeException e) {
					logger.log(WARNING, "Unable to cleanly close session", e);
				}
			}
		} finally {
			getLock().unlock();
		}
	}

	@NonNull
	protected CqlSession createSession(@NonNull ConnectionParameters connectionParameters) {
		requireNonNull(connectionParameters);
		return createSessionBuilder(connectionParameters).build();
	}

	@NonNull
	protected CqlSessionBuilder createSessionBuilder(@NonNull ConnectionParameters connectionParameters) {
		requireNonNull(connectionParameters);

		DriverConfigLoader configLoader = DriverConfigLoader.programmaticBuilder()
				.withString(DefaultDriverOption.PROTOCOL_VERSION, PROTOCOL_VERSION)
				.withDuration(DefaultDriverOption.CONNECTION_CONNECT_TIMEOUT, connectionParameters.getConnectTimeout())
				.withDuration(DefaultDriverOption.CONNECTION_INIT_QUERY_TIMEOUT, connectionParameters.getConnectTimeout())
				.withDuration(DefaultDriverOption.REQUEST_TIMEOUT, connectionParameters.getRequestTimeout())
				.build();

		CqlSessionBuilder sessionBuilder = CqlSession.builder()
				.withConfigLoader(configLoader)
				.withLocalDatacenter(connectionParameters.getDatacenter());

		for (String host : connectionParameters.getHosts())
			sessionBuilder.addContactPoint(new InetSocketAddress(host, connectionParameters.getPort()));

		return sessionBuilder;
	}

	@NonNull
	protected ConnectionParameters getConnectionParameters() {
		return this.connectionParameters;
	}

	@NonNull
	protected DriverValueFormatter getValueFormatter() {
		return this.valueFormatter;
	}

	@NonNull
	protected ReentrantLock getLock() {
		return this.lock;
	}
}
