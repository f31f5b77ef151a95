package it.safecourse.common.dto.identity;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request to check that a fiscal code belongs to the given surname and name.
 * Used by the enrollment form before saving a student.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NameMatchRequest {

    @NotBlank(message = "Fiscal code is required")
    private String fiscalCode;

    @NotBlank(message = "Surname is required")
    private String surname;

    @NotBlank(message = "Given name is required")
    private String givenName;
}
