package it.safecourse.common.dto.identity;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Outcome of a fiscal code validation.
 *
 * {@code valid} only reflects length and character classes. A wrong check character
 * is reported through {@code checksumValid} and a warning, never as an error.
 */
@Value
@Builder
public class FiscalCodeValidationResult {

    boolean valid;
    boolean checksumValid;

    /**
     * Input after upper-casing and whitespace removal.
     */
    String normalized;

    @Singular
    List<String> errors;

    @Singular
    List<String> warnings;
}
