package com.barlang.core.model;

import java.util.Collection;
import java.util.List;

/**
 * Exception thrown when input market data or signal data is unusable:
 * - A required OHLCV field is missing from the price series
 * - Dates are duplicated or out of order, or columns differ in length
 * - A signal series is not aligned with its price series
 */
public class DataException extends RuntimeException {

    private final List<String> missingFields;

    public DataException(String message) {
        super(message);
        this.missingFields = List.of();
    }

    public DataException(String message, Throwable cause) {
        super(message, cause);
        this.missingFields = List.of();
    }

    private DataException(String message, Collection<String> missingFields) {
        super(message);
        this.missingFields = List.copyOf(missingFields);
    }

    public static DataException missingFields(Collection<String> fields) {
        return new DataException("Price series is missing required fields: " + String.join(", ", fields), fields);
    }

    public List<String> getMissingFields() {
        return missingFields;
    }
}
