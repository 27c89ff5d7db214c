package com.example.baldnessdetector.service.detector;

import com.example.baldnessdetector.dto.response.BaldnessResult;

public interface BaldnessDetector {

    /**
     * @param imageData raw bytes of the uploaded photo
     * @throws com.example.baldnessdetector.exception.InvalidImageException if the bytes are not a readable image
     */
    BaldnessResult analyze(byte[] imageData);
}
