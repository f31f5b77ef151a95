package it.safecourse.common.dto.identity;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Outcome of a VAT number (Partita IVA) validation.
 */
@Value
@Builder
public class VatValidationResult {

    boolean valid;
    boolean checksumValid;

    @Singular
    List<String> errors;

    @Singular
    List<String> warnings;

    /**
     * Normalized 11-digit form (digits only, no IT prefix). Empty for blank input.
     */
    String formatted;
}
