package it.safecourse.common.dto.identity;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request carrying a company VAT number, with or without IT prefix.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VatNumberRequest {

    @NotBlank(message = "VAT number is required")
    private String vatNumber;
}
