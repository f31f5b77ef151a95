package it.safecourse.identity.controller;

import it.safecourse.common.dto.ApiResponse;
import it.safecourse.common.dto.identity.FiscalCodeRequest;
import it.safecourse.common.dto.identity.FiscalCodeValidationResult;
import it.safecourse.common.dto.identity.NameFragmentRequest;
import it.safecourse.common.dto.identity.NameMatchRequest;
import it.safecourse.common.dto.identity.ReverseEngineeredIdentity;
import it.safecourse.identity.service.FiscalCodeService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * REST Controller for fiscal code checks.
 *
 * IMPORTANT: Controllers contain NO business logic.
 * All logic is delegated to FiscalCodeService.
 */
@RestController
@RequestMapping("/api/identity/fiscal-codes")
@RequiredArgsConstructor
@Tag(name = "Fiscal codes", description = "Codice Fiscale validation and decoding")
public class FiscalCodeController {

    private final FiscalCodeService fiscalCodeService;

    @PostMapping("/validate")
    @Operation(summary = "Validate a fiscal code (format errors, checksum and omocodia warnings)")
    public ResponseEntity<ApiResponse<FiscalCodeValidationResult>> validate(
            @Valid @RequestBody FiscalCodeRequest request) {

        FiscalCodeValidationResult result = fiscalCodeService.validate(request.getFiscalCode());
        return ResponseEntity.ok(ApiResponse.success(result));
    }

    @PostMapping("/reverse")
    @Operation(summary = "Derive birth date, birth place and sex from a fiscal code")
    public ResponseEntity<ApiResponse<ReverseEngineeredIdentity>> reverse(
            @Valid @RequestBody FiscalCodeRequest request) {

        ReverseEngineeredIdentity identity = fiscalCodeService.reverse(request.getFiscalCode());
        return ResponseEntity.ok(ApiResponse.success(identity));
    }

    @GetMapping("/check-character")
    @Operation(summary = "Compute the check character from the first 15 characters")
    public ResponseEntity<ApiResponse<Map<String, String>>> checkCharacter(@RequestParam String first15) {
        char checkCharacter = fiscalCodeService.computeCheckCharacter(first15);
        return ResponseEntity.ok(ApiResponse.success(Map.of("checkCharacter", String.valueOf(checkCharacter))));
    }

    @PostMapping("/name-fragment")
    @Operation(summary = "Generate the six-letter surname and name part")
    public ResponseEntity<ApiResponse<Map<String, String>>> nameFragment(
            @Valid @RequestBody NameFragmentRequest request) {

        String fragment = fiscalCodeService.generateNameFragment(request.getSurname(), request.getGivenName());
        return ResponseEntity.ok(ApiResponse.success(Map.of("fragment", fragment)));
    }

    @PostMapping("/name-match")
    @Operation(summary = "Check that a fiscal code corresponds to surname and name")
    public ResponseEntity<ApiResponse<Map<String, Boolean>>> nameMatch(
            @Valid @RequestBody NameMatchRequest request) {

        boolean matches = fiscalCodeService.matchesName(
                request.getFiscalCode(), request.getSurname(), request.getGivenName());
        return ResponseEntity.ok(ApiResponse.success(Map.of("matches", matches)));
    }
}
