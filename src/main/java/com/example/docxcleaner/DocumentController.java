package com.example.docxcleaner;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api")
public class DocumentController {

    static final String DOCX_MEDIA_TYPE = "application/vnd.openxmlformats-officedocument.wordprocessingml.document";

    @Autowired
    private CleanerService cleanerService;

    @GetMapping("/")
    public String home() {
        return "DOCX Cleaner is running!";
    }

    @PostMapping("/clean")
    public ResponseEntity<byte[]> clean(@RequestParam("file") MultipartFile file) throws IOException, CleanerException {
        String filename = file.getOriginalFilename() == null ? "upload.docx" : file.getOriginalFilename();
        log.info("clean upload: name={}, size={}", filename, file.getSize());
        if (!filename.toLowerCase(Locale.ROOT).endsWith(".docx")) {
            throw new IllegalArgumentException("unsupported file type: " + filename + " (only .docx)");
        }

        CleanerService.CleanedDocument cleaned = cleanerService.clean(file.getBytes(), filename);
        String outName = cleanerService.outputFileName(baseName(filename));

        return ResponseEntity.ok()
                .header("Content-Disposition", "attachment; filename=\"" + outName + "\"")
                .header("X-Parts-Processed", String.valueOf(cleaned.summary.getPartsProcessed()))
                .header("X-Characters-Removed", String.valueOf(cleaned.summary.getCharactersRemoved()))
                .contentType(MediaType.parseMediaType(DOCX_MEDIA_TYPE))
                .body(cleaned.data);
    }

    @ExceptionHandler(CleanerException.class)
    public ResponseEntity<Map<String, Object>> handleCleaner(CleanerException e) {
        HttpStatus status;
        switch (e.getKind()) {
            case INVALID_CONTAINER:
            case MALFORMED_XML:
                status = HttpStatus.BAD_REQUEST;
                break;
            default:
                status = HttpStatus.INTERNAL_SERVER_ERROR;
        }
        log.warn("clean failed: {}", e.describe());
        return ResponseEntity.status(status).body(errorBody(status, e.getKind().name(), e.describe()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleBadRequest(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(errorBody(HttpStatus.BAD_REQUEST, "BAD_REQUEST", e.getMessage()));
    }

    private static Map<String, Object> errorBody(HttpStatus status, String error, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", status.value());
        body.put("error", error);
        body.put("message", message);
        return body;
    }

    private static String baseName(String filename) {
        String n = filename.replace('\\', '/');
        return n.substring(n.lastIndexOf('/') + 1).replace("\"", "");
    }
}
