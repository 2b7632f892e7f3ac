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
import javax.annotation.concurrent.ThreadSafe;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Immutable settings for reaching a cluster: contact points, port, local datacenter, timeouts, and optionally the
 * keyspace and table to use.
 * <p>
 * Settings may be parsed from a semicolon-separated {@code key=value} string, for example
 * {@code hosts=10.0.0.1,10.0.0.2; port=9042; keyspace=shop; table=orders; verbose=yes}. See {@link #parse(String)}.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class ConnectionParameters {
	@NonNull
	public static final String DEFAULT_HOST = "127.0.0.1";
	public static final int DEFAULT_PORT = 9042;
	@NonNull
	public static final String DEFAULT_DATACENTER = "datacenter1";
	@NonNull
	public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);

	// Parameter names may also carry this prefix, e.g. scylla_hosts
	@NonNull
	private static final String LEGACY_KEY_PREFIX = "scylla_";

	@NonNull
	private final List<String> hosts;
	private final int port;
	@Nullable
	private final String keyspace;
	@Nullable
	private final String table;
	@NonNull
	private final String datacenter;
	private final boolean verbose;
	@NonNull
	private final Duration connectTimeout;
	@NonNull
	private final Duration requestTimeout;

	private ConnectionParameters(@NonNull Builder builder) {
		requireNonNull(builder);

		this.hosts = builder.hosts.isEmpty() ? List.of(DEFAULT_HOST) : Collections.unmodifiableList(new ArrayList<>(builder.hosts));
		this.port = builder.port;
		this.keyspace = builder.keyspace;
		this.table = builder.table;
		this.datacenter = builder.datacenter;
		this.verbose = builder.verbose;
		this.connectTimeout = builder.connectTimeout;
		this.requestTimeout = builder.requestTimeout;
	}

	/**
	 * @return parameters with every default applied
	 */
	@NonNull
	public static ConnectionParameters withDefaults() {
		return builder().build();
	}

	@NonNull
	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Parses semicolon-separated {@code key=value} tokens.
	 * <p>
	 * Keys and values are trimmed. Tokens without {@code =} and unrecognized keys are ignored. Recognized keys are
	 * {@code hosts} (comma-separated), {@code port}, {@code keyspace}, {@code table}, {@code datacenter} and
	 * {@code verbose} ({@code true}, {@code 1} or {@code yes}, ignoring case). Each may also be written with a
	 * {@code scylla_} prefix.
	 *
	 * @param parameters the parameter string, may be {@code null} or empty
	 * @return the parsed parameters, defaults applied
	 * @throws IllegalArgumentException if {@code port} is not an integer between 1 and 65535
	 */
	@NonNull
	public static ConnectionParameters parse(@Nullable String parameters) {
		Builder builder = builder();

		if (parameters == null || parameters.isBlank())
			return builder.build();

		for (String token : parameters.split(";")) {
			int equalsIndex = token.indexOf('=');

			if (equalsIndex < 0)
				continue;

			String key = token.substring(0, equalsIndex).trim();
			String value = token.substring(equalsIndex + 1).trim();

			if (key.startsWith(LEGACY_KEY_PREFIX))
				key = key.substring(LEGACY_KEY_PREFIX.length());

			switch (key) {
				case "hosts":
					builder.hosts(Arrays.stream(value.split(","))
							.map(String::trim)
							.filter(host -> !host.isEmpty())
							.collect(Collectors.toList()));
					break;
				case "port":
					builder.port(parsePort(value));
					break;
				case "keyspace":
					builder.keyspace(value.isEmpty() ? null : value);
					break;
				case "table":
					builder.table(value.isEmpty() ? null : value);
					break;
				case "datacenter":
					if (!value.isEmpty())
						builder.datacenter(value);
					break;
				case "verbose":
					builder.verbose(parseBoolean(value));
					break;
				default:
					break;
			}
		}

		return builder.build();
	}

	private static int parsePort(@NonNull String value) {
		requireNonNull(value);

		int port;

		try {
			port = Integer.parseInt(value);
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException(format("Port '%s' is not an integer", value), e);
		}

		validatePort(port);
		return port;
	}

	private static void validatePort(int port) {
		if (port < 1 || port > 65535)
			throw new IllegalArgumentException(format("Port %d is outside the range 1-65535", port));
	}

	private static boolean parseBoolean(@NonNull String value) {
		requireNonNull(value);
		String normalized = value.toLowerCase(Locale.ROOT);
		return "true".equals(normalized) || "1".equals(normalized) || "yes".equals(normalized);
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof ConnectionParameters))
			return false;

		ConnectionParameters connectionParameters = (ConnectionParameters) object;

		return Objects.equals(getHosts(), connectionParameters.getHosts())
				&& getPort() == connectionParameters.getPort()
				&& Objects.equals(getKeyspace(), connectionParameters.getKeyspace())
				&& Objects.equals(getTable(), connectionParameters.getTable())
				&& Objects.equals(getDatacenter(), connectionParameters.getDatacenter())
				&& isVerbose() == connectionParameters.isVerbose()
				&& Objects.equals(getConnectTimeout(), connectionParameters.getConnectTimeout())
				&& Objects.equals(getRequestTimeout(), connectionParameters.getRequestTimeout());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getHosts(), getPort(), getKeyspace(), getTable(), getDatacenter(), isVerbose(),
				getConnectTimeout(), getRequestTimeout());
	}

	@Override
	public String toString() {
		List<String> components = new ArrayList<>(8);

		components.add(format("hosts=%s", getHosts()));
		components.add(format("port=%d", getPort()));

		String keyspace = getKeyspace().orElse(null);

		if (keyspace != null)
			components.add(format("keyspace=%s", keyspace));

		String table = getTable().orElse(null);

		if (table != null)
			components.add(format("table=%s", table));

		components.add(format("datacenter=%s", getDatacenter()));
		components.add(format("verbose=%s", isVerbose()));
		components.add(format("connectTimeout=%s", getConnectTimeout()));
		components.add(format("requestTimeout=%s", getRequestTimeout()));

		return format("%s{%s}", getClass().getSimpleName(), components.stream().collect(Collectors.joining(", ")));
	}

	/**
	 * @return contact points; never empty
	 */
	@NonNull
	public List<String> getHosts() {
		return this.hosts;
	}

	public int getPort() {
		return this.port;
	}

	@NonNull
	public Optional<String> getKeyspace() {
		return Optional.ofNullable(this.keyspace);
	}

	@NonNull
	public Optional<String> getTable() {
		return Optional.ofNullable(this.table);
	}

	/**
	 * @return the datacenter the driver treats as local
	 */
	@NonNull
	public String getDatacenter() {
		return this.datacenter;
	}

	/**
	 * @return {@code true} if executed statements should be logged at {@code INFO} rather than {@code FINE}
	 */
	public boolean isVerbose() {
		return this.verbose;
	}

	@NonNull
	public Duration getConnectTimeout() {
		return this.connectTimeout;
	}

	@NonNull
	public Duration getRequestTimeout() {
		return this.requestTimeout;
	}

	/**
	 * Builder used to construct instances of {@link ConnectionParameters}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @since 1.0.0
	 */
	@NotThreadSafe
	public static class Builder {
		@NonNull
		private List<String> hosts;
		private int port;
		@Nullable
		private String keyspace;
		@Nullable
		private String table;
		@NonNull
		private String datacenter;
		private boolean verbose;
		@NonNull
		private Duration connectTimeout;
		@NonNull
		private Duration requestTimeout;

		private Builder() {
			this.hosts = List.of();
			this.port = DEFAULT_PORT;
			this.datacenter = DEFAULT_DATACENTER;
			this.connectTimeout = DEFAULT_TIMEOUT;
			this.requestTimeout = DEFAULT_TIMEOUT;
		}

		/**
		 * An empty list means {@value ConnectionParameters#DEFAULT_HOST}.
		 */
		@NonNull
		public Builder hosts(@NonNull List<String> hosts) {
			requireNonNull(hosts);
			this.hosts = List.copyOf(hosts);
			return this;
		}

		@NonNull
		public Builder port(int port) {
			validatePort(port);
			this.port = port;
			return this;
		}

		@NonNull
		public Builder keyspace(@Nullable String keyspace) {
			this.keyspace = keyspace;
			return this;
		}

		@NonNull
		public Builder table(@Nullable String table) {
			this.table = table;
			return this;
		}

		@NonNull
		public Builder datacenter(@NonNull String datacenter) {
			requireNonNull(datacenter);
			this.datacenter = datacenter;
			return this;
		}

		@NonNull
		public Builder verbose(boolean verbose) {
			this.verbose = verbose;
			return this;
		}

		@NonNull
		public Builder connectTimeout(@NonNull Duration connectTimeout) {
			requireNonNull(connectTimeout);
			this.connectTimeout = connectTimeout;
			return this;
		}

		@NonNull
		public Builder requestTimeout(@NonNull Duration requestTimeout) {
			requireNonNull(requestTimeout);
			this.requestTimeout = requestTimeout;
			return this;
		}

		@NonNull
		public ConnectionParameters build() {
			return new ConnectionParameters(this);
		}
	}
}
