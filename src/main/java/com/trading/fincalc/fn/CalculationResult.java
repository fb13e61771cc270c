package com.trading.fincalc.fn;

import java.util.List;

/**
 * Output envelope of every calculator.
 *
 * @param methodology   Short description of the method used.
 * @param value         The computed value.
 * @param warnings      Non-fatal issues, e.g. a solver fallback.
 * @param elapsedMicros Wall time of the calculation.
 */
public record CalculationResult<T>(String methodology, T value, List<String> warnings, long elapsedMicros) {
    public CalculationResult {
        warnings = List.copyOf(warnings);
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
