package it.safecourse.identity.controller;

import it.safecourse.common.infrastructure.RequestCorrelationFilter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
@DisplayName("Fiscal code endpoints")
class FiscalCodeControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Test
    @DisplayName("Valid code returns 200 with a clean result")
    void validate_ShouldReturnResult() throws Exception {
        mockMvc.perform(post("/api/identity/fiscal-codes/validate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"fiscalCode\": \"rssmra80a01h501u\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.valid").value(true))
                .andExpect(jsonPath("$.data.checksumValid").value(true))
                .andExpect(jsonPath("$.data.normalized").value("RSSMRA80A01H501U"))
                .andExpect(jsonPath("$.data.warnings", hasSize(0)));
    }

    @Test
    @DisplayName("Invalid code is still a 200: callers decide")
    void validate_ShouldReturnErrorsWithOk() throws Exception {
        mockMvc.perform(post("/api/identity/fiscal-codes/validate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"fiscalCode\": \"RSSMRA80\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.valid").value(false))
                .andExpect(jsonPath("$.data.errors[0]").value("Lunghezza non valida: 8 caratteri (richiesti 16)"));
    }

    @Test
    @DisplayName("Missing fiscal code is rejected by bean validation")
    void validate_ShouldRejectMissingField() throws Exception {
        mockMvc.perform(post("/api/identity/fiscal-codes/validate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.errorCode").value("SC_ERR_400"))
                .andExpect(jsonPath("$.message").value("Fiscal code is required"));
    }

    @Test
    @DisplayName("Malformed JSON body is a 400")
    void validate_ShouldRejectMalformedBody() throws Exception {
        mockMvc.perform(post("/api/identity/fiscal-codes/validate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"fiscalCode\":"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("SC_ERR_400"));
    }

    @Test
    @DisplayName("Reverse returns birth data for pre-filling the enrollment form")
    void reverse_ShouldReturnIdentity() throws Exception {
        mockMvc.perform(post("/api/identity/fiscal-codes/reverse")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"fiscalCode\": \"BNCLRA85T45F205L\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.birthDate").value("1985-12-05"))
                .andExpect(jsonPath("$.data.sex").value("F"))
                .andExpect(jsonPath("$.data.birthPlace").value("MILANO"))
                .andExpect(jsonPath("$.data.province").value("MI"))
                .andExpect(jsonPath("$.data.cadastralCode").value("F205"));
    }

    @Test
    @DisplayName("Check character endpoint")
    void checkCharacter_ShouldComputeCharacter() throws Exception {
        mockMvc.perform(get("/api/identity/fiscal-codes/check-character").param("first15", "RSSMRA80A01H501"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.checkCharacter").value("U"));
    }

    @Test
    @DisplayName("Check character with a short prefix is a 400")
    void checkCharacter_ShouldRejectShortPrefix() throws Exception {
        mockMvc.perform(get("/api/identity/fiscal-codes/check-character").param("first15", "RSSMRA"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message", containsString("first15")));
    }

    @Test
    @DisplayName("Check character without parameter is a 400")
    void checkCharacter_ShouldRequireParameter() throws Exception {
        mockMvc.perform(get("/api/identity/fiscal-codes/check-character"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("SC_ERR_400"));
    }

    @Test
    @DisplayName("Name fragment and name match")
    void nameEndpoints_ShouldAgree() throws Exception {
        mockMvc.perform(post("/api/identity/fiscal-codes/name-fragment")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"surname\": \"Rossi\", \"givenName\": \"Mario\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.fragment").value("RSSMRA"));

        mockMvc.perform(post("/api/identity/fiscal-codes/name-match")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"fiscalCode\": \"RSSMRA80A01H501U\", \"surname\": \"Rossi\", \"givenName\": \"Mario\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.matches").value(true));

        mockMvc.perform(post("/api/identity/fiscal-codes/name-match")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"fiscalCode\": \"RSSMRA80A01H501U\", \"surname\": \"Verdi\", \"givenName\": \"Mario\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.matches").value(false));
    }

    @Test
    @DisplayName("Request id is echoed back")
    void requests_ShouldCarryRequestId() throws Exception {
        mockMvc.perform(post("/api/identity/fiscal-codes/validate")
                        .header(RequestCorrelationFilter.HEADER, "req-42")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"fiscalCode\": \"RSSMRA80A01H501U\"}"))
                .andExpect(status().isOk())
                .andExpect(header().string(RequestCorrelationFilter.HEADER, "req-42"));
    }
}
