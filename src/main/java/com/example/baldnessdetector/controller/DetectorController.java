package com.example.baldnessdetector.controller;

import com.example.baldnessdetector.dto.response.BaldnessResult;
import com.example.baldnessdetector.exception.InvalidImageException;
import com.example.baldnessdetector.service.detector.BaldnessDetector;
import com.example.baldnessdetector.service.detector.DetectionStreamEncoder;
import lombok.AccessLevel;
import lombok.RequiredArgsConstructor;
import lombok.experimental.FieldDefaults;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.servlet.mvc.method.annotation.StreamingResponseBody;

import java.io.IOException;

@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE, makeFinal = true)
@Slf4j
public class DetectorController {
    BaldnessDetector baldnessDetector;
    DetectionStreamEncoder streamEncoder;

    @PostMapping(value = "/detect-baldness", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<BaldnessResult> detectBaldness(@RequestParam("photo") MultipartFile photo) {
        return ResponseEntity.ok(analyze(photo));
    }

    /**
     * Same analysis, returned as a length-prefixed metadata frame followed by the raw PNG.
     */
    @PostMapping(value = "/detect-baldness/stream", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<StreamingResponseBody> detectBaldnessStream(@RequestParam("photo") MultipartFile photo) {
        // Analyse up front so image errors still produce a JSON error response
        BaldnessResult result = analyze(photo);
        StreamingResponseBody body = out -> streamEncoder.write(result, out);
        return ResponseEntity.ok()
                .contentType(MediaType.APPLICATION_OCTET_STREAM)
                .body(body);
    }

    private BaldnessResult analyze(MultipartFile photo) {
        String contentType = photo.getContentType();
        if (contentType == null || !contentType.startsWith("image/")) {
            throw new InvalidImageException("File must be an image");
        }
        byte[] data;
        try {
            data = photo.getBytes();
        } catch (IOException e) {
            throw new InvalidImageException("Unable to read uploaded file", e);
        }
        BaldnessResult result = baldnessDetector.analyze(data);
        log.info("Analysed {} ({} bytes): level={}, category={}",
                photo.getOriginalFilename(), data.length, result.getBaldnessLevel(), result.getBaldnessCategory());
        return result;
    }
}
