package org.iceforge.kpigate.server.service;

/** Host, token or warehouse id is missing, so no statement can be sent. */
public class StatementServiceNotConfiguredException extends RuntimeException {

    public StatementServiceNotConfiguredException() {
        super("Server missing Databricks credentials");
    }
}
