package eu.okaeri.owsql.provenance;

import eu.okaeri.owsql.OwsqlException;

/**
 * Thrown when a value that is not fixed in program source is offered as trusted SQL.
 */
public class ProvenanceRejectedException extends OwsqlException {

    public ProvenanceRejectedException(String message) {
        super(message);
    }
}
