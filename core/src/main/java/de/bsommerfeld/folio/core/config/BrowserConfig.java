package de.bsommerfeld.folio.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Tunables for the browser core. Every field has a default so an absent or
 * partial {@code config.json} is valid.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class BrowserConfig {

    /** Minimum visible fraction before a pending element is revealed. */
    @JsonProperty("reveal-threshold")
    private double revealThreshold = 0.12;

    /** Pause between a filter-driven re-render and reveal re-registration. */
    @JsonProperty("reveal-settle-delay-ms")
    private long revealSettleDelayMs = 50;

    /** Navigation landmarks in page order; the first is active initially. */
    @JsonProperty("landmarks")
    private List<String> landmarks = new ArrayList<>(List.of("home", "projects", "certs", "contact"));

    @JsonProperty("landmark-thresholds")
    private List<Double> landmarkThresholds = new ArrayList<>(List.of(0.15, 0.25, 0.35, 0.5));

    /** Landmark scrolled to by the overlay's "back to projects" action. */
    @JsonProperty("catalog-landmark")
    private String catalogLandmark = "projects";

    /** Revealable elements that are not catalog entries (hero cards, section heads). */
    @JsonProperty("reveal-elements")
    private List<String> revealElements = new ArrayList<>(List.of(
            "home/intro", "home/summary",
            "projects/head",
            "certs/head",
            "contact/head", "contact/reach", "contact/profiles", "contact/footer"));

    @JsonProperty("contact-email")
    private String contactEmail = "ifrad.hossain04@gmail.com";

    public double getRevealThreshold() {
        return revealThreshold;
    }

    public void setRevealThreshold(double revealThreshold) {
        this.revealThreshold = revealThreshold;
    }

    public long getRevealSettleDelayMs() {
        return revealSettleDelayMs;
    }

    public void setRevealSettleDelayMs(long revealSettleDelayMs) {
        this.revealSettleDelayMs = revealSettleDelayMs;
    }

    public List<String> getLandmarks() {
        return landmarks;
    }

    public void setLandmarks(List<String> landmarks) {
        this.landmarks = landmarks;
    }

    public List<Double> getLandmarkThresholds() {
        return landmarkThresholds;
    }

    public void setLandmarkThresholds(List<Double> landmarkThresholds) {
        this.landmarkThresholds = landmarkThresholds;
    }

    public String getCatalogLandmark() {
        return catalogLandmark;
    }

    public void setCatalogLandmark(String catalogLandmark) {
        this.catalogLandmark = catalogLandmark;
    }

    public List<String> getRevealElements() {
        return revealElements;
    }

    public void setRevealElements(List<String> revealElements) {
        this.revealElements = revealElements;
    }

    public String getContactEmail() {
        return contactEmail;
    }

    public void setContactEmail(String contactEmail) {
        this.contactEmail = contactEmail;
    }

    /**
     * Checks ranges and cross-field consistency.
     *
     * @throws ConfigurationException on the first violation found
     */
    public void validate() {
        checkFraction("reveal-threshold", revealThreshold);
        if (revealSettleDelayMs < 0) {
            throw new ConfigurationException("reveal-settle-delay-ms must not be negative: " + revealSettleDelayMs);
        }
        if (landmarkThresholds == null || landmarkThresholds.isEmpty()) {
            throw new ConfigurationException("landmark-thresholds must not be empty");
        }
        for (Double threshold : landmarkThresholds) {
            if (threshold == null) {
                throw new ConfigurationException("landmark-thresholds must not contain null");
            }
            checkFraction("landmark-thresholds", threshold);
        }
        if (landmarks == null) {
            throw new ConfigurationException("landmarks must not be null");
        }
        if (catalogLandmark != null && !landmarks.isEmpty() && !landmarks.contains(catalogLandmark)) {
            throw new ConfigurationException(
                    "catalog-landmark '" + catalogLandmark + "' is not one of " + landmarks);
        }
    }

    private static void checkFraction(String key, double value) {
        if (value < 0.0 || value > 1.0 || Double.isNaN(value)) {
            throw new ConfigurationException(key + " must be within [0, 1]: " + value);
        }
    }
}
