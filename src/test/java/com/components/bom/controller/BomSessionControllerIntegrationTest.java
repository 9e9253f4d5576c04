package com.components.bom.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.context.WebApplicationContext;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
class BomSessionControllerIntegrationTest {

    private static final String BOM = """
            {
              "sourceName": "power-board.csv",
              "header": ["Designator", "Manufacturer Part Number", "Value", "Footprint", "Qty"],
              "rows": [
                ["R1", "RC0603FR-071KL", "1k", "0603", 1],
                ["R2", "RC0603FR-071KL", "1k", "0603", 1],
                ["C1, C2", null, "100nF", "0603", 2]
              ]
            }
            """;

    private static final String CANDIDATES = """
            {
              "candidates": [
                {"ManufacturerPartNumber": "RC0603FR-071KL", "MouserPartNumber": "603-B",
                 "Package": "0805", "AvailabilityInStock": "0", "LifecycleStatus": "Obsolete",
                 "PriceBreaks": [{"Quantity": 1, "Price": "$0.25", "Currency": "USD"}]},
                {"ManufacturerPartNumber": "RC0603FR-071KL", "MouserPartNumber": "603-A",
                 "Package": "0603", "AvailabilityInStock": "500", "LifecycleStatus": "Active",
                 "PriceBreaks": [{"Quantity": 1, "Price": "$0.10", "Currency": "USD"}]},
                {"Description": "record without part number"}
              ],
              "allowObsolete": true
            }
            """;

    private MockMvc mockMvc;

    @Autowired
    private WebApplicationContext context;

    @Autowired
    private ObjectMapper objectMapper;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.webAppContextSetup(context).build();
    }

    @Test
    void fullWorkflowFromUploadToExport() throws Exception {
        String sessionId = openSession();

        mockMvc.perform(get("/api/bom/sessions/{id}/items", sessionId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2))
                .andExpect(jsonPath("$[0].refDes[1]").value("R2"))
                .andExpect(jsonPath("$[0].quantity").value(2))
                .andExpect(jsonPath("$[0].fields.MPN").value("RC0603FR-071KL"))
                .andExpect(jsonPath("$[1].refDes.length()").value(2));

        mockMvc.perform(post("/api/bom/sessions/{id}/items/1/rank", sessionId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(CANDIDATES))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ranked[0].candidate.candidateId").value("603-A"))
                .andExpect(jsonPath("$.ranked[0].breakdown.packageMatch").value(1.0))
                .andExpect(jsonPath("$.ranked[1].breakdown.lifecycle").value(0.0))
                .andExpect(jsonPath("$.rejected.length()").value(1));

        mockMvc.perform(get("/api/bom/sessions/{id}/items/1/candidates", sessionId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2));

        mockMvc.perform(put("/api/bom/sessions/{id}/items/1/selection", sessionId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"candidateId\": \"603-A\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.selectedCandidateId").value("603-A"));

        mockMvc.perform(put("/api/bom/sessions/{id}/items/2/selection/not-available", sessionId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.selectedCandidateId").value("NA"));

        mockMvc.perform(get("/api/bom/sessions/{id}/export", sessionId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2))
                .andExpect(jsonPath("$[0].refDes").value("R1, R2"))
                .andExpect(jsonPath("$[0].distributorPartNumber").value("603-A"))
                .andExpect(jsonPath("$[1].mpn").value("NA"));

        mockMvc.perform(delete("/api/bom/sessions/{id}/items/2/selection", sessionId))
                .andExpect(status().isNoContent());

        mockMvc.perform(delete("/api/bom/sessions/{id}", sessionId))
                .andExpect(status().isNoContent());
        mockMvc.perform(get("/api/bom/sessions/{id}/items", sessionId))
                .andExpect(status().isNotFound());
    }

    @Test
    void selectingUnrankedCandidateIsBadRequest() throws Exception {
        String sessionId = openSession();

        mockMvc.perform(put("/api/bom/sessions/{id}/items/1/selection", sessionId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"candidateId\": \"nope\"}"))
                .andExpect(status().isBadRequest());
        mockMvc.perform(put("/api/bom/sessions/{id}/items/1/selection", sessionId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"candidateId\": \"\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.title").value("Validation failed"));
    }

    @Test
    void blankHeaderIsRejected() throws Exception {
        mockMvc.perform(post("/api/bom/sessions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"header\": [\" \", \"\"], \"rows\": []}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.title").value("Invalid BOM"));
    }

    @Test
    void unknownSessionAndItemAreNotFound() throws Exception {
        mockMvc.perform(get("/api/bom/sessions/{id}/items", "missing"))
                .andExpect(status().isNotFound());

        String sessionId = openSession();
        mockMvc.perform(get("/api/bom/sessions/{id}/items/99/candidates", sessionId))
                .andExpect(status().isNotFound());
    }

    @Test
    void lookupWithoutCatalogClientIsUnavailable() throws Exception {
        String sessionId = openSession();

        mockMvc.perform(post("/api/bom/sessions/{id}/items/1/lookup", sessionId))
                .andExpect(status().isServiceUnavailable());
        mockMvc.perform(post("/api/bom/sessions/{id}/lookup", sessionId))
                .andExpect(status().isServiceUnavailable());
    }

    private String openSession() throws Exception {
        MvcResult result = mockMvc.perform(post("/api/bom/sessions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(BOM))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.columns[0].field").value("RefDes"))
                .andExpect(jsonPath("$.openedAt").isNotEmpty())
                .andExpect(jsonPath("$.lineItems.length()").value(2))
                .andReturn();
        JsonNode body = objectMapper.readTree(result.getResponse().getContentAsString());
        return body.get("sessionId").asText();
    }
}
