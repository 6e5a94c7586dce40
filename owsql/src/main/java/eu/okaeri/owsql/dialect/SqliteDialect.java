package eu.okaeri.owsql.dialect;

public class SqliteDialect extends StandardSqlDialect {

    @Override
    public String getName() {
        return "SQLite";
    }
}
