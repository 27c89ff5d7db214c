package com.example.baldnessdetector.controller;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
public class ServiceInfoController {

    static final String VERSION = "1.0.0";

    @GetMapping("/")
    public Map<String, Object> root() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", "Baldness Detection API");
        body.put("version", VERSION);
        body.put("endpoints", List.of(
                "POST /api/v1/auth/google",
                "POST /api/v1/auth/email",
                "GET /api/v1/auth/me",
                "GET /api/v1/auth/health",
                "POST /api/v1/detect-baldness",
                "POST /api/v1/detect-baldness/stream"));
        return body;
    }
}
