package com.example.baldnessdetector.dto.response;

import com.example.baldnessdetector.model.BaldnessRegion;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BaldnessArea {
    private BaldnessRegion region;
    /** 0..1 */
    private double confidenceScore;
    /** 0..100 */
    private double pixelPercentage;
}
