package eu.okaeri.owsql;

/**
 * Receives rows one at a time from {@link OwsqlConnection#iterate(String, RowCallback)}.
 */
@FunctionalInterface
public interface RowCallback {

    /**
     * @param row current row
     * @return false to stop processing further rows
     */
    boolean accept(Row row);
}
