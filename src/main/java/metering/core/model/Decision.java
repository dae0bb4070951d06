package metering.core.model;

public enum Decision {
    ALLOW,
    REJECT
}
