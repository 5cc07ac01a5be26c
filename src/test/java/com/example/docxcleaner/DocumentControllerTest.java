package com.example.docxcleaner;

import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.io.ByteArrayInputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

@SpringBootTest
@AutoConfigureMockMvc
class DocumentControllerTest {

    @Autowired
    private MockMvc mvc;

    @TempDir
    Path dir;

    @Test
    void homeRespondsWhenRunning() throws Exception {
        mvc.perform(get("/api/"))
                .andExpect(status().isOk())
                .andExpect(content().string("DOCX Cleaner is running!"));
    }

    @Test
    void uploadReturnsCleanedDocument() throws Exception {
        Path src = DocxFixtures.writePoiDocument(dir.resolve("memo.docx"), "top\u200B", "one\u200Btwo", "\uFEFFthree");
        MockMultipartFile file = new MockMultipartFile("file", "memo.docx",
                DocumentController.DOCX_MEDIA_TYPE, Files.readAllBytes(src));

        MvcResult res = mvc.perform(multipart("/api/clean").file(file))
                .andExpect(status().isOk())
                .andExpect(header().string("Content-Disposition", containsString("memo_cleaned.docx")))
                .andExpect(header().string("X-Parts-Processed", "2"))
                .andExpect(header().string("X-Characters-Removed", "3"))
                .andExpect(content().contentType(DocumentController.DOCX_MEDIA_TYPE))
                .andReturn();

        try (XWPFDocument doc = new XWPFDocument(new ByteArrayInputStream(res.getResponse().getContentAsByteArray()))) {
            List<String> texts = doc.getParagraphs().stream().map(XWPFParagraph::getText).collect(Collectors.toList());
            assertEquals(List.of("onetwo", "three"), texts);
        }
    }

    @Test
    void nonDocxNameIsBadRequest() throws Exception {
        MockMultipartFile file = new MockMultipartFile("file", "old.doc", "application/msword", new byte[] {1, 2, 3});

        mvc.perform(multipart("/api/clean").file(file))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("BAD_REQUEST"));
    }

    @Test
    void brokenPackageIsBadRequest() throws Exception {
        MockMultipartFile file = new MockMultipartFile("file", "broken.docx",
                DocumentController.DOCX_MEDIA_TYPE, "not a zip".getBytes());

        mvc.perform(multipart("/api/clean").file(file))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value(400))
                .andExpect(jsonPath("$.error").value("INVALID_CONTAINER"));
    }
}
