package com.example.baldnessdetector.dto.response;

import com.example.baldnessdetector.model.BaldnessCategory;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BaldnessResult {
    /** Base64 encoded PNG with the detected areas highlighted. */
    private String processedImage;
    private double baldnessLevel;
    private BaldnessCategory baldnessCategory;
    @Builder.Default
    private List<BaldnessArea> baldnessAreas = new ArrayList<>();
}
