package com.example.docxcleaner;

import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Controller;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseBody;

import java.util.LinkedHashMap;
import java.util.Map;

/** 兜底 /error：统一输出 JSON，和 DocumentController 的错误体字段一致 */
@Slf4j
@Controller
public class ErrorController implements org.springframework.boot.web.servlet.error.ErrorController {

    @RequestMapping("/error")
    @ResponseBody
    public ResponseEntity<Map<String, Object>> handleError(HttpServletRequest request) {
        Map<String, Object> errorDetails = new LinkedHashMap<>();

        Integer statusCode = (Integer) request.getAttribute("jakarta.servlet.error.status_code");
        String errorMessage = (String) request.getAttribute("jakarta.servlet.error.message");
        Throwable exception = (Throwable) request.getAttribute("jakarta.servlet.error.exception");
        int status = statusCode != null ? statusCode : 500;

        errorDetails.put("status", status);
        HttpStatus resolved = HttpStatus.resolve(status);
        errorDetails.put("error", exception instanceof CleanerException
                ? ((CleanerException) exception).getKind().name()
                : resolved != null ? resolved.getReasonPhrase() : "Internal Server Error");
        errorDetails.put("message", errorMessage != null && !errorMessage.isEmpty()
                ? errorMessage : "An unexpected error occurred");

        if (exception != null) {
            errorDetails.put("exception", exception.getClass().getSimpleName());
            errorDetails.put("details", exception.getMessage());
            log.error("request failed: {}", errorDetails, exception);
        } else {
            log.warn("request failed: {}", errorDetails);
        }

        return ResponseEntity.status(status).body(errorDetails);
    }
}
