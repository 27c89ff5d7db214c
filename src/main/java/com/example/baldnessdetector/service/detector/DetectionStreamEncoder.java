package com.example.baldnessdetector.service.detector;

import com.example.baldnessdetector.dto.response.BaldnessResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.io.DataOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Binary framing of a detection result: a metadata frame followed by an image frame,
 * each prefixed with its length as a 4-byte big-endian integer.
 */
@Component
@RequiredArgsConstructor
public class DetectionStreamEncoder {

    private final ObjectMapper objectMapper;

    public void write(BaldnessResult result, OutputStream outputStream) throws IOException {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("baldnessLevel", result.getBaldnessLevel());
        metadata.put("baldnessCategory", result.getBaldnessCategory());
        metadata.put("baldnessAreas", result.getBaldnessAreas());

        byte[] metadataJson = objectMapper.writeValueAsBytes(metadata);
        byte[] image = Base64.getDecoder().decode(result.getProcessedImage());

        DataOutputStream out = new DataOutputStream(outputStream);
        out.writeInt(metadataJson.length);
        out.write(metadataJson);
        out.writeInt(image.length);
        out.write(image);
        out.flush();
    }
}
