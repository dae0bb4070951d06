package metering.core.store;

/**
 * @param admitted whether a marker was inserted
 * @param count markers in the window after the call
 */
public record WindowAdmission(boolean admitted, long count) {
}
