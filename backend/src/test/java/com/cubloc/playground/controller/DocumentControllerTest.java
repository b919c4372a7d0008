package com.cubloc.playground.controller;

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
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class DocumentControllerTest {

    @Autowired
    private MockMvc mockMvc;

    private void open(String uri, int version, String text) throws Exception {
        mockMvc.perform(post("/api/documents/open")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(documentJson(uri, version, text)))
                .andExpect(status().isOk());
    }

    private static String documentJson(String uri, int version, String text) {
        return "{\"uri\":\"" + uri + "\",\"version\":" + version + ",\"text\":\"" + text + "\"}";
    }

    @Test
    void testOpenReturnsDiagnostics() throws Exception {
        mockMvc.perform(post("/api/documents/open")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(documentJson("file:///open.cul", 1, "FOR i = 1 TO 10")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.uri").value("file:///open.cul"))
                .andExpect(jsonPath("$.version").value(1))
                .andExpect(jsonPath("$.diagnostics", hasSize(1)))
                .andExpect(jsonPath("$.diagnostics[0].message").value("Missing Next for For."))
                .andExpect(jsonPath("$.diagnostics[0].source").value("cubloc-basic"));
    }

    @Test
    void testChangeReplacesDiagnostics() throws Exception {
        open("file:///change.cul", 1, "FOR i = 1 TO 10");

        mockMvc.perform(post("/api/documents/change")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(documentJson("file:///change.cul", 2, "FOR i = 1 TO 10\\nNEXT")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.version").value(2))
                .andExpect(jsonPath("$.diagnostics", hasSize(0)));
    }

    @Test
    void testCloseEmptiesDiagnosticsAndForgetsDocument() throws Exception {
        open("file:///close.cul", 1, "OUT 300, 1");

        mockMvc.perform(get("/api/documents/diagnostics").param("uri", "file:///close.cul"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.diagnostics[0].message").value("Out port must be 0 to 255."));

        mockMvc.perform(post("/api/documents/close")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"uri\":\"file:///close.cul\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.diagnostics", hasSize(0)));

        mockMvc.perform(get("/api/documents/diagnostics").param("uri", "file:///close.cul"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Document is not open: file:///close.cul"));
    }

    @Test
    void testHover() throws Exception {
        open("file:///hover.cul", 1, "Delay 10\\n  x = 1");

        mockMvc.perform(post("/api/documents/hover")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"uri\":\"file:///hover.cul\",\"line\":0,\"character\":2}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.keyword").value("DELAY"))
                .andExpect(jsonPath("$.label").value("Delay"))
                .andExpect(jsonPath("$.kind").value("markdown"))
                .andExpect(jsonPath("$.contents").value(containsString("milliseconds")));

        mockMvc.perform(post("/api/documents/hover")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"uri\":\"file:///hover.cul\",\"line\":1,\"character\":0}"))
                .andExpect(status().isNoContent());
    }

    @Test
    void testInvalidRequests() throws Exception {
        mockMvc.perform(post("/api/documents/open")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"uri\":\" \",\"text\":\"PRINT 1\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value(containsString("uri - Document uri cannot be blank")));

        mockMvc.perform(post("/api/documents/hover")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"uri\":\"file:///x.cul\",\"line\":-1,\"character\":0}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void testCompletion() throws Exception {
        mockMvc.perform(get("/api/completion"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(21)))
                .andExpect(jsonPath("$[8].label").value("End If"))
                .andExpect(jsonPath("$[8].kind").value(14));
    }
}
