package it.safecourse.common.dto.identity;

import lombok.Value;

/**
 * Italian municipality identified by its cadastral code.
 */
@Value
public class Municipality {

    String cadastralCode;
    String name;

    /**
     * Two-letter province abbreviation.
     */
    String province;
}
