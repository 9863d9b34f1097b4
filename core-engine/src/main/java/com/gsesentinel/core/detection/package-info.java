/**
 * Anomaly and threshold detection.
 *
 * <p>
 * Every detection step implements
 * {@link com.gsesentinel.core.detection.AnomalyDetector}; a
 * {@link com.gsesentinel.core.detection.DetectionChain} runs them in order
 * and returns the first {@link com.gsesentinel.core.detection.Verdict} that
 * fires:
 * </p>
 * <ol>
 * <li>{@link com.gsesentinel.core.detection.ThresholdDetector}: value outside
 * the parameter's [min, max]</li>
 * <li>{@link com.gsesentinel.core.detection.StatisticalOutlierDetector}: value
 * more than N × σ from the rolling mean</li>
 * </ol>
 *
 * @since 1.0.0
 */
package com.gsesentinel.core.detection;
