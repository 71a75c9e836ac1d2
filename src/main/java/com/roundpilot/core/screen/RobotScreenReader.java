package com.roundpilot.core.screen;

import com.roundpilot.core.model.ColorSample;
import com.roundpilot.core.model.Region;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.AWTException;
import java.awt.HeadlessException;
import java.awt.Rectangle;
import java.awt.Robot;
import java.awt.image.BufferedImage;

/**
 * {@link ScreenReader} backed by {@link Robot} screen captures.
 * <p>
 * Text recognition is delegated to a {@link TextRecognizer}; without one, text
 * and numeric reads fail with {@link ReadException} and only phase sampling works.
 */
public class RobotScreenReader implements ScreenReader {

    private static final Logger log = LoggerFactory.getLogger(RobotScreenReader.class);

    private final Robot robot;
    private final TextRecognizer recognizer;

    public RobotScreenReader(Robot robot, TextRecognizer recognizer) {
        this.robot = robot;
        this.recognizer = recognizer;
    }

    /**
     * Creates a reader on the default screen.
     *
     * @throws ReadException if the environment has no screen to capture
     */
    public static RobotScreenReader create(TextRecognizer recognizer) {
        try {
            return new RobotScreenReader(new Robot(), recognizer);
        } catch (AWTException | SecurityException | HeadlessException e) {
            throw new ReadException("Screen capture unavailable: " + e.getMessage(), e);
        }
    }

    @Override
    public ColorSample sampleColor(Region region) {
        BufferedImage image = capture(region);
        long r = 0, g = 0, b = 0;
        int w = image.getWidth();
        int h = image.getHeight();
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                int rgb = image.getRGB(x, y);
                r += (rgb >> 16) & 0xFF;
                g += (rgb >> 8) & 0xFF;
                b += rgb & 0xFF;
            }
        }
        double n = (double) w * h;
        return new ColorSample(r / n, g / n, b / n);
    }

    @Override
    public String readText(Region region) {
        if (recognizer == null) {
            throw new ReadException("No text recognizer configured");
        }
        BufferedImage image = capture(region);
        String text;
        try {
            text = recognizer.recognize(image);
        } catch (RuntimeException e) {
            throw new ReadException("Text recognition failed: " + e.getMessage(), e);
        }
        log.trace("Recognized '{}' in {}", text, region);
        return text;
    }

    private BufferedImage capture(Region region) {
        try {
            // Robot serializes captures internally, so concurrent workers may share it.
            return robot.createScreenCapture(
                    new Rectangle(region.left(), region.top(), region.width(), region.height()));
        } catch (RuntimeException e) {
            throw new ReadException("Screen capture failed for " + region + ": " + e.getMessage(), e);
        }
    }
}
