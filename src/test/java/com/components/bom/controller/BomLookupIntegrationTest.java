package com.components.bom.controller;

import com.components.bom.service.core.CatalogSearchClient;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.context.WebApplicationContext;

import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
class BomLookupIntegrationTest {

    private static final String BOM = """
            {
              "sourceName": "sensor-board.csv",
              "header": ["Designator", "Manufacturer Part Number", "Value", "Footprint"],
              "rows": [
                ["R1", "XYZ-404", "1k", "0603"],
                ["C1, C2", null, "100nF", "C_0603_1608Metric"]
              ]
            }
            """;

    @MockBean
    private CatalogSearchClient catalog;

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
    void suggestedKeywordCanBeEditedAndSearched() throws Exception {
        String sessionId = openSession();
        when(catalog.searchByKeyword("100nF X7R 0603", 50)).thenReturn(List.of(Map.of(
                "ManufacturerPartNumber", "GRM188R71H104KA93D",
                "MouserPartNumber", "81-GRM188R71H104KA3D",
                "Package", "0603",
                "AvailabilityInStock", "12000",
                "LifecycleStatus", "Active",
                "PriceBreaks", List.of(Map.of("Quantity", 1, "Price", "$0.10", "Currency", "USD")))));

        mockMvc.perform(get("/api/bom/sessions/{id}/items/2/keyword", sessionId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.keyword").value("100nF 0603"));

        mockMvc.perform(post("/api/bom/sessions/{id}/items/2/lookup", sessionId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"keyword\": \" 100nF  X7R 0603 \"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.strategy").value("KEYWORD"))
                .andExpect(jsonPath("$.searchKey").value("100nF X7R 0603"))
                .andExpect(jsonPath("$.ranked[0].candidate.candidateId").value("81-GRM188R71H104KA3D"));

        mockMvc.perform(get("/api/bom/sessions/{id}/items/2/candidates", sessionId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1));
        verify(catalog, never()).searchByPartNumber(anyString());
    }

    @Test
    void lookupWithoutKeywordSearchesByMpnFirst() throws Exception {
        String sessionId = openSession();
        when(catalog.searchByPartNumber("XYZ-404")).thenReturn(List.of());
        when(catalog.searchByKeyword("1k 0603", 50)).thenReturn(List.of());

        mockMvc.perform(post("/api/bom/sessions/{id}/items/1/lookup", sessionId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"keyword\": \"  \"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.strategy").value("KEYWORD"))
                .andExpect(jsonPath("$.searchKey").value("1k 0603"));

        verify(catalog).searchByPartNumber("XYZ-404");
    }

    private String openSession() throws Exception {
        MvcResult result = mockMvc.perform(post("/api/bom/sessions")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(BOM))
                .andExpect(status().isCreated())
                .andReturn();
        JsonNode body = objectMapper.readTree(result.getResponse().getContentAsString());
        return body.get("sessionId").asText();
    }
}
