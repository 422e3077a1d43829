package io.tempora.core.database;

import io.tempora.spi.config.ConfigException;

/**
 * Supported relational stores and the SQL dialect details that differ
 * between them.
 */
public enum DatabaseType
{
    H2("org.h2.Driver", "bigint generated by default as identity primary key", "varchar(255)", "clob", "timestamp"),
    POSTGRESQL("org.postgresql.Driver", "bigserial primary key", "text", "text", "timestamp with time zone");

    private final String driverClassName;
    private final String longIdType;
    private final String stringType;
    private final String textType;
    private final String timestampType;

    DatabaseType(String driverClassName, String longIdType, String stringType, String textType, String timestampType)
    {
        this.driverClassName = driverClassName;
        this.longIdType = longIdType;
        this.stringType = stringType;
        this.textType = textType;
        this.timestampType = timestampType;
    }

    public String getDriverClassName()
    {
        return driverClassName;
    }

    public String longIdType()
    {
        return longIdType;
    }

    public String stringType()
    {
        return stringType;
    }

    public String textType()
    {
        return textType;
    }

    public String timestampType()
    {
        return timestampType;
    }

    /**
     * {@code memory} is H2 without a path.
     */
    public static DatabaseType fromConfigName(String name)
    {
        switch (name) {
        case "memory":
        case "h2":
            return H2;
        case "postgresql":
            return POSTGRESQL;
        default:
            throw new ConfigException("Unknown database.type: " + name);
        }
    }
}
