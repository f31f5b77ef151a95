package it.safecourse.common.dto.identity;

import lombok.Value;

/**
 * Sub-fields of a well-formed VAT number.
 */
@Value
public class VatNumberInfo {

    /** Digits 1-7. */
    String taxpayerCode;

    /** Digits 8-10, provincial office. */
    String officeCode;

    /** Digit 11. */
    String checkDigit;
}
