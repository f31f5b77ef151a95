package it.safecourse.common.dto.identity;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * Birth data and sex derived from a fiscal code.
 *
 * Every field is best effort and may be null. The data is derived, never authoritative.
 */
@Value
@Builder
public class ReverseEngineeredIdentity {

    private static final ReverseEngineeredIdentity EMPTY = ReverseEngineeredIdentity.builder().build();

    /**
     * Present only when year, month and day resolved to a real calendar date.
     */
    LocalDate birthDate;

    Integer birthYear;
    Integer birthMonth;
    Integer birthDay;

    /**
     * Municipality name, or "Codice: XXXX" when the code is not in the sample table.
     */
    String birthPlace;

    String province;
    String cadastralCode;
    Sex sex;

    public static ReverseEngineeredIdentity empty() {
        return EMPTY;
    }
}
