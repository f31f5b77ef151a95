package it.safecourse.identity.controller;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
@DisplayName("VAT number and municipality endpoints")
class VatNumberControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Test
    void validate_ShouldReturnResult() throws Exception {
        mockMvc.perform(post("/api/identity/vat-numbers/validate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"vatNumber\": \"IT 1234567-1007\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.valid").value(true))
                .andExpect(jsonPath("$.data.checksumValid").value(true))
                .andExpect(jsonPath("$.data.formatted").value("12345671007"))
                .andExpect(jsonPath("$.data.warnings", hasSize(0)));
    }

    @Test
    void validate_ShouldReportAllZeros() throws Exception {
        mockMvc.perform(post("/api/identity/vat-numbers/validate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"vatNumber\": \"00000000000\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.valid").value(false))
                .andExpect(jsonPath("$.data.errors[0]").value("Partita IVA non valida: tutti zeri"));
    }

    @Test
    void validate_ShouldRejectBlankField() throws Exception {
        mockMvc.perform(post("/api/identity/vat-numbers/validate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"vatNumber\": \"  \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("VAT number is required"));
    }

    @Test
    void format_ShouldPrefixOrReturnUnchanged() throws Exception {
        mockMvc.perform(post("/api/identity/vat-numbers/format")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"vatNumber\": \"123 456 789 03\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.formatted").value("IT12345678903"));

        mockMvc.perform(post("/api/identity/vat-numbers/format")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"vatNumber\": \"123-45\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.formatted").value("123-45"));
    }

    @Test
    void info_ShouldSplitOrReject() throws Exception {
        mockMvc.perform(get("/api/identity/vat-numbers/info").param("vatNumber", "IT12345678903"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.taxpayerCode").value("1234567"))
                .andExpect(jsonPath("$.data.officeCode").value("890"))
                .andExpect(jsonPath("$.data.checkDigit").value("3"));

        mockMvc.perform(get("/api/identity/vat-numbers/info").param("vatNumber", "1234"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false));
    }

    @Test
    @DisplayName("Missing query parameter is a 400 in the standard envelope")
    void info_ShouldRejectMissingParameter() throws Exception {
        mockMvc.perform(get("/api/identity/vat-numbers/info"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.errorCode").value("SC_ERR_400"))
                .andExpect(jsonPath("$.message").value(containsString("vatNumber")));
    }

    @Test
    void municipality_ShouldBeFoundOrNotFound() throws Exception {
        mockMvc.perform(get("/api/identity/municipalities/{code}", "H501"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.name").value("ROMA"))
                .andExpect(jsonPath("$.data.province").value("RM"));

        mockMvc.perform(get("/api/identity/municipalities/{code}", "Z404"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.errorCode").value("SC_ERR_404"));
    }
}
