package it.safecourse.identity.controller;

import it.safecourse.common.dto.ApiResponse;
import it.safecourse.common.dto.identity.VatNumberInfo;
import it.safecourse.common.dto.identity.VatNumberRequest;
import it.safecourse.common.dto.identity.VatValidationResult;
import it.safecourse.identity.service.VatNumberService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * REST Controller for company VAT number checks.
 */
@RestController
@RequestMapping("/api/identity/vat-numbers")
@RequiredArgsConstructor
@Tag(name = "VAT numbers", description = "Partita IVA validation and formatting")
public class VatNumberController {

    private final VatNumberService vatNumberService;

    @PostMapping("/validate")
    @Operation(summary = "Validate a VAT number")
    public ResponseEntity<ApiResponse<VatValidationResult>> validate(
            @Valid @RequestBody VatNumberRequest request) {

        VatValidationResult result = vatNumberService.validate(request.getVatNumber());
        return ResponseEntity.ok(ApiResponse.success(result));
    }

    @PostMapping("/format")
    @Operation(summary = "Format a VAT number with the IT prefix (unchanged when invalid)")
    public ResponseEntity<ApiResponse<Map<String, String>>> format(
            @Valid @RequestBody VatNumberRequest request) {

        String formatted = vatNumberService.formatWithCountryPrefix(request.getVatNumber());
        return ResponseEntity.ok(ApiResponse.success(Map.of("formatted", formatted)));
    }

    @GetMapping("/info")
    @Operation(summary = "Split a VAT number into taxpayer, office and check digit")
    public ResponseEntity<ApiResponse<VatNumberInfo>> info(@RequestParam String vatNumber) {
        return ResponseEntity.ok(ApiResponse.success(vatNumberService.extractInfo(vatNumber)));
    }
}
