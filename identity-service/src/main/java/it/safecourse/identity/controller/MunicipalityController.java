package it.safecourse.identity.controller;

import it.safecourse.common.dto.ApiResponse;
import it.safecourse.common.dto.identity.Municipality;
import it.safecourse.identity.service.FiscalCodeService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/identity/municipalities")
@RequiredArgsConstructor
@Tag(name = "Municipalities", description = "Birth place lookup by cadastral code (sample table)")
public class MunicipalityController {

    private final FiscalCodeService fiscalCodeService;

    @GetMapping("/{cadastralCode}")
    @Operation(summary = "Get municipality by cadastral code")
    public ResponseEntity<ApiResponse<Municipality>> getMunicipality(@PathVariable String cadastralCode) {
        return ResponseEntity.ok(ApiResponse.success(fiscalCodeService.findMunicipality(cadastralCode)));
    }
}
