package it.safecourse.common.dto.identity;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request for the six-letter name part of a fiscal code.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NameFragmentRequest {

    @NotBlank(message = "Surname is required")
    private String surname;

    @NotBlank(message = "Given name is required")
    private String givenName;
}
