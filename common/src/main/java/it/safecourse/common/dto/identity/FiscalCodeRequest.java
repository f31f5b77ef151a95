package it.safecourse.common.dto.identity;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request carrying a fiscal code as typed by the user.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FiscalCodeRequest {

    @NotBlank(message = "Fiscal code is required")
    private String fiscalCode;
}
