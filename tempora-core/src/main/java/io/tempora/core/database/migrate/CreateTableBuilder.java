package io.tempora.core.database.migrate;

import java.util.ArrayList;
import java.util.List;
import io.tempora.core.database.DatabaseType;

/**
 * Builds a CREATE TABLE statement in the dialect of a {@link DatabaseType}.
 * Options such as "not null" are appended to the column type verbatim.
 */
public class CreateTableBuilder
{
    private final DatabaseType type;
    private final String name;
    private final List<String> columns = new ArrayList<>();

    private CreateTableBuilder(DatabaseType type, String name)
    {
        this.type = type;
        this.name = name;
    }

    public static CreateTableBuilder createTable(DatabaseType type, String name)
    {
        return new CreateTableBuilder(type, name);
    }

    private CreateTableBuilder column(String column, String sqlType, String options)
    {
        columns.add(options.isEmpty() ? column + " " + sqlType : column + " " + sqlType + " " + options);
        return this;
    }

    public CreateTableBuilder addLongId(String column)
    {
        return column(column, type.longIdType(), "");
    }

    public CreateTableBuilder addIntIdNoAutoIncrement(String column)
    {
        return column(column, "int primary key", "");
    }

    public CreateTableBuilder addInt(String column, String options)
    {
        return column(column, "int", options);
    }

    public CreateTableBuilder addLong(String column, String options)
    {
        return column(column, "bigint", options);
    }

    public CreateTableBuilder addDouble(String column, String options)
    {
        return column(column, "double precision", options);
    }

    public CreateTableBuilder addBoolean(String column, String options)
    {
        return column(column, "boolean", options);
    }

    public CreateTableBuilder addString(String column, String options)
    {
        return column(column, type.stringType(), options);
    }

    public CreateTableBuilder addMediumText(String column, String options)
    {
        return column(column, type.textType(), options);
    }

    public CreateTableBuilder addTimestamp(String column, String options)
    {
        return column(column, type.timestampType(), options);
    }

    public String build()
    {
        return "CREATE TABLE " + name + " (\n  " + String.join(",\n  ", columns) + "\n)";
    }
}
