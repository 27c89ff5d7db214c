package com.example.baldnessdetector.service.detector;

import com.example.baldnessdetector.config.AppProperties;
import com.example.baldnessdetector.dto.response.BaldnessArea;
import com.example.baldnessdetector.dto.response.BaldnessResult;
import com.example.baldnessdetector.exception.InvalidImageException;
import com.example.baldnessdetector.model.BaldnessCategory;
import com.example.baldnessdetector.model.BaldnessRegion;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;
import java.awt.AlphaComposite;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Iterator;
import java.util.List;
import java.util.Random;

/**
 * Placeholder for the real model: the level is random and the highlighted spots are
 * drawn at random positions over the upper part of the photo.
 */
@Service
public class SimulatedBaldnessDetector implements BaldnessDetector {

    private static final Color SPOT_FILL = new Color(255, 0, 0, 64);
    private static final Color SPOT_OUTLINE = new Color(255, 0, 0, 128);

    private final Random random;
    private final long maxPixels;

    @Autowired
    public SimulatedBaldnessDetector(AppProperties properties) {
        this(new Random(), properties.getDetector().getMaxPixels());
    }

    SimulatedBaldnessDetector(Random random, long maxPixels) {
        this.random = random;
        this.maxPixels = maxPixels;
    }

    @Override
    public BaldnessResult analyze(byte[] imageData) {
        BufferedImage image = decode(imageData);

        double level = round(random.nextDouble(), 2);
        BufferedImage processed = highlightBaldAreas(image, level);

        return BaldnessResult.builder()
                .processedImage(Base64.getEncoder().encodeToString(encodePng(processed)))
                .baldnessLevel(level)
                .baldnessCategory(BaldnessCategory.fromLevel(level))
                .baldnessAreas(generateAreas(level))
                .build();
    }

    private BufferedImage decode(byte[] imageData) {
        if (imageData == null || imageData.length == 0) {
            throw new InvalidImageException("Uploaded file is empty");
        }
        try (ImageInputStream input = ImageIO.createImageInputStream(new ByteArrayInputStream(imageData))) {
            Iterator<ImageReader> readers = input == null ? null : ImageIO.getImageReaders(input);
            if (readers == null || !readers.hasNext()) {
                throw new InvalidImageException("Uploaded file is not a supported image");
            }
            ImageReader reader = readers.next();
            try {
                reader.setInput(input, true, true);
                // Header dimensions only, no pixel data allocated yet
                long pixels = (long) reader.getWidth(0) * reader.getHeight(0);
                if (pixels > maxPixels) {
                    throw new InvalidImageException("Image is too large: " + reader.getWidth(0) + "x"
                            + reader.getHeight(0) + " exceeds " + maxPixels + " pixels");
                }
                return reader.read(0);
            } finally {
                reader.dispose();
            }
        } catch (IOException e) {
            throw new InvalidImageException("Unable to read uploaded image", e);
        }
    }

    private BufferedImage highlightBaldAreas(BufferedImage source, double level) {
        int width = source.getWidth();
        int height = source.getHeight();
        BufferedImage copy = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
        Graphics2D g = copy.createGraphics();
        try {
            g.drawImage(source, 0, 0, null);
            g.setComposite(AlphaComposite.SrcOver);

            int spots = (int) (level * 10) + 1;
            int size = (int) (level * 50) + 10;
            for (int i = 0; i < spots; i++) {
                // Top of the head: middle half horizontally, between 1/8 and 1/3 vertically
                int x = between(width / 4, 3 * width / 4);
                int y = between(height / 8, height / 3);
                g.setColor(SPOT_FILL);
                g.fillOval(x - size, y - size, size * 2, size * 2);
                g.setColor(SPOT_OUTLINE);
                g.drawOval(x - size, y - size, size * 2, size * 2);
            }
        } finally {
            g.dispose();
        }
        return copy;
    }

    private List<BaldnessArea> generateAreas(double level) {
        List<BaldnessArea> areas = new ArrayList<>();
        for (BaldnessRegion region : BaldnessRegion.values()) {
            // Low levels leave some regions out
            if (level < 0.5 && random.nextDouble() > level * 2) {
                continue;
            }
            double confidence = Math.min(1.0, Math.max(0.1, level * (0.8 + random.nextDouble() * 0.4)));
            double pixelPct = confidence * 100 * (0.7 + random.nextDouble() * 0.3);
            areas.add(BaldnessArea.builder()
                    .region(region)
                    .confidenceScore(round(confidence, 2))
                    .pixelPercentage(round(pixelPct, 1))
                    .build());
        }
        return areas;
    }

    private int between(int lower, int upper) {
        return upper <= lower ? lower : lower + random.nextInt(upper - lower + 1);
    }

    private static byte[] encodePng(BufferedImage image) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            ImageIO.write(image, "png", out);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to encode processed image", e);
        }
        return out.toByteArray();
    }

    private static double round(double value, int places) {
        double scale = Math.pow(10, places);
        return Math.round(value * scale) / scale;
    }
}
