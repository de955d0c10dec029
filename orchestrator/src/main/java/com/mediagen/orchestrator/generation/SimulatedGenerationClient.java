package com.mediagen.orchestrator.generation;

import com.mediagen.orchestrator.model.FailureKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.UUID;

/**
 * Stand-in for the real generation service, used for demos and local runs.
 *
 * Behaves like the real API: every call takes a random latency, a configurable
 * fraction of calls fail transiently, and a poll resolves a prediction to
 * succeeded (80%), failed or still processing. Produced images are solid PNGs.
 */
public class SimulatedGenerationClient implements GenerationClient {

    private static final Logger log = LoggerFactory.getLogger(SimulatedGenerationClient.class);

    private static final String OUTPUT_URL_PREFIX = "https://replicate.delivery/pbxt/mock-image-";
    private static final int    IMAGE_SIZE        = 512;

    static final int DEFAULT_TRACKED_PREDICTIONS = 1000;

    /** Latest state per handle, least recently used evicted first. */
    private final Map<String, PollResult> predictions;

    private final Duration minLatency;
    private final Duration maxLatency;
    private final double   failureRate;
    private final Random   random;

    public SimulatedGenerationClient(Duration minLatency, Duration maxLatency, double failureRate, Random random) {
        this(minLatency, maxLatency, failureRate, random, DEFAULT_TRACKED_PREDICTIONS);
    }

    SimulatedGenerationClient(Duration minLatency, Duration maxLatency, double failureRate, Random random,
                              int maxTracked) {
        if (maxLatency.compareTo(minLatency) < 0) {
            throw new IllegalArgumentException("maxLatency must not be shorter than minLatency");
        }
        this.minLatency  = minLatency;
        this.maxLatency  = maxLatency;
        this.failureRate = failureRate;
        this.random      = random;
        this.predictions = Collections.synchronizedMap(new LinkedHashMap<String, PollResult>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, PollResult> eldest) {
                return size() > maxTracked;
            }
        });
    }

    @Override
    public String submit(String model, GenerationInput input) {
        simulateLatency();
        if (random.nextDouble() < failureRate) {
            throw new GenerationException(FailureKind.TRANSIENT, "Simulated API failure for model " + model);
        }
        String handle = UUID.randomUUID().toString();
        predictions.put(handle, PollResult.processing());
        log.debug("Simulated prediction {} accepted for model '{}'", handle, model);
        return handle;
    }

    @Override
    public PollResult poll(String handle) {
        simulateLatency();
        PollResult known = predictions.get(handle);
        if (known == null) {
            throw GenerationException.fatal("Unknown prediction " + handle);
        }
        if (known.status() != PollResult.Status.PROCESSING) {
            return known;
        }
        if (random.nextDouble() < failureRate * 0.5) {
            throw new GenerationException(FailureKind.TRANSIENT, "Failed to fetch prediction " + handle);
        }

        PollResult result = resolve(handle);
        predictions.put(handle, result);
        return result;
    }

    private PollResult resolve(String handle) {
        if (random.nextDouble() < 0.8) {
            return PollResult.succeeded(List.of(OUTPUT_URL_PREFIX + handle + ".png"));
        }
        if (random.nextDouble() < 0.3) {
            return PollResult.failed("Mock generation failed - insufficient GPU memory");
        }
        return PollResult.processing();
    }

    int trackedPredictions() {
        return predictions.size();
    }

    @Override
    public byte[] fetch(String url) {
        simulateLatency();
        return renderImage(url.hashCode());
    }

    private static byte[] renderImage(int seed) {
        BufferedImage image = new BufferedImage(IMAGE_SIZE, IMAGE_SIZE, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = image.createGraphics();
        try {
            g.setColor(new Color(100, 150, 200 ^ (seed & 0x3f)));
            g.fillRect(0, 0, IMAGE_SIZE, IMAGE_SIZE);
        } finally {
            g.dispose();
        }
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            ImageIO.write(image, "png", out);
        } catch (IOException e) {
            throw new UncheckedIOException("PNG encoding failed", e);
        }
        return out.toByteArray();
    }

    private void simulateLatency() {
        long min = minLatency.toMillis();
        long span = maxLatency.toMillis() - min;
        long delay = min + (span > 0 ? (long) (random.nextDouble() * span) : 0);
        if (delay <= 0) {
            return;
        }
        try {
            Thread.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GenerationException(FailureKind.TRANSIENT, "Simulated call interrupted", e);
        }
    }
}
