package it.safecourse.identity.service;

import it.safecourse.common.dto.identity.VatNumberInfo;
import it.safecourse.common.dto.identity.VatValidationResult;
import it.safecourse.common.exception.ValidationException;
import it.safecourse.common.util.VatNumberCodec;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Service for company VAT number (Partita IVA) checks.
 */
@Slf4j
@Service
public class VatNumberService {

    public VatValidationResult validate(String vatNumber) {
        VatValidationResult result = VatNumberCodec.validate(vatNumber);

        if (!result.isValid()) {
            log.info("Rejected VAT number {}: {}", result.getFormatted(), result.getErrors());
        } else if (!result.getWarnings().isEmpty()) {
            log.info("VAT number {} accepted with warnings: {}", result.getFormatted(), result.getWarnings());
        } else {
            log.debug("VAT number {} valid", result.getFormatted());
        }
        return result;
    }

    public String formatWithCountryPrefix(String vatNumber) {
        return VatNumberCodec.formatWithCountryPrefix(vatNumber);
    }

    public VatNumberInfo extractInfo(String vatNumber) {
        return VatNumberCodec.extractInfo(vatNumber)
                .orElseThrow(() -> new ValidationException("vatNumber", "must contain exactly 11 digits"));
    }
}
