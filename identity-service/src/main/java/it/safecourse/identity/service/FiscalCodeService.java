package it.safecourse.identity.service;

import it.safecourse.common.dto.identity.FiscalCodeValidationResult;
import it.safecourse.common.dto.identity.Municipality;
import it.safecourse.common.dto.identity.ReverseEngineeredIdentity;
import it.safecourse.common.exception.ResourceNotFoundException;
import it.safecourse.common.exception.ValidationException;
import it.safecourse.common.util.FiscalCodeCodec;
import it.safecourse.common.util.MunicipalityTable;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Year;

/**
 * Service for fiscal code (Codice Fiscale) checks used by student enrollment.
 *
 * ALL logic is delegated to FiscalCodeCodec; this layer adds the clock,
 * logging and the translation of bad input into ValidationException.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FiscalCodeService {

    private final Clock clock;

    public FiscalCodeValidationResult validate(String fiscalCode) {
        FiscalCodeValidationResult result = FiscalCodeCodec.validate(fiscalCode);

        if (!result.isValid()) {
            log.info("Rejected fiscal code {}: {}", mask(result.getNormalized()), result.getErrors());
        } else if (!result.getWarnings().isEmpty()) {
            log.info("Fiscal code {} accepted with warnings: {}", mask(result.getNormalized()), result.getWarnings());
        } else {
            log.debug("Fiscal code {} valid", mask(result.getNormalized()));
        }
        return result;
    }

    /**
     * Derive birth data and sex. The century is resolved against the current year of the clock.
     */
    public ReverseEngineeredIdentity reverse(String fiscalCode) {
        int currentYear = Year.now(clock).getValue();
        ReverseEngineeredIdentity identity = FiscalCodeCodec.reverse(fiscalCode, currentYear);

        if (identity.getCadastralCode() == null) {
            log.debug("Fiscal code {} not well formed, nothing derived", mask(FiscalCodeCodec.normalize(fiscalCode)));
        } else if (identity.getProvince() == null) {
            log.debug("Cadastral code {} not in the municipality sample", identity.getCadastralCode());
        }
        return identity;
    }

    public char computeCheckCharacter(String first15) {
        try {
            return FiscalCodeCodec.computeCheckCharacter(first15);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("first15", e.getMessage(), e);
        }
    }

    public String generateNameFragment(String surname, String givenName) {
        return FiscalCodeCodec.generateNameFragment(surname, givenName);
    }

    public boolean matchesName(String fiscalCode, String surname, String givenName) {
        boolean matches = FiscalCodeCodec.matchesName(fiscalCode, surname, givenName);
        if (!matches) {
            log.info("Fiscal code {} does not match the given surname and name", mask(FiscalCodeCodec.normalize(fiscalCode)));
        }
        return matches;
    }

    public Municipality findMunicipality(String cadastralCode) {
        return MunicipalityTable.find(cadastralCode)
                .orElseThrow(() -> new ResourceNotFoundException("Municipality", cadastralCode));
    }

    // Only the name part is logged, birth data stays out of the logs
    private static String mask(String code) {
        if (code == null || code.length() <= 6) {
            return "******";
        }
        return code.substring(0, 6) + "*".repeat(code.length() - 6);
    }
}
