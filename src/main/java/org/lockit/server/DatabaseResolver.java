package org.lockit.server;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps a connection string to the database type and the adapter module that serves it.
 */
public final class DatabaseResolver {
	private static final Pattern SCHEME = Pattern.compile("^([A-Za-z][A-Za-z0-9+.\\-]*):");
	private static final String SQL_ADAPTER = "lockit-sql-adapter";

	private DatabaseResolver() {
	}

	public static DatabaseAdapter resolve(DatabaseConfig db) {
		if (db == null)
			throw new UnrecognizedSchemeException("no database configured");
		return resolve(db.url());
	}

	public static DatabaseAdapter resolve(String connection) {
		if (connection == null)
			throw new UnrecognizedSchemeException("connection string is null");
		Matcher m = SCHEME.matcher(connection.trim());
		if (!m.find())
			throw new UnrecognizedSchemeException("no scheme in connection string '" + connection + "'");

		String scheme = m.group(1).toLowerCase(Locale.ROOT);
		return switch (scheme) {
		case "http", "https" -> new DatabaseAdapter("couchdb", "lockit-couchdb-adapter");
		case "mongodb" -> new DatabaseAdapter("mongodb", "lockit-mongodb-adapter");
		case "postgres" -> new DatabaseAdapter("postgresql", SQL_ADAPTER);
		case "mysql" -> new DatabaseAdapter("mysql", SQL_ADAPTER);
		case "sqlite" -> new DatabaseAdapter("sqlite", SQL_ADAPTER);
		default -> throw new UnrecognizedSchemeException("unrecognized database scheme '" + scheme + "'");
		};
	}
}
