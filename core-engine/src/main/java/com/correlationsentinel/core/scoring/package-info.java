/**
 * Alert scoring and deduplication.
 *
 * <ul>
 * <li>{@link com.correlationsentinel.core.scoring.ConfidenceScorer} – 0–100
 * confidence</li>
 * <li>{@link com.correlationsentinel.core.scoring.DedupeKeys} – stable keys
 * over rule, organization and dedupe field values</li>
 * <li>{@link com.correlationsentinel.core.scoring.Deduplicator} – suppression
 * intervals per key</li>
 * <li>{@link com.correlationsentinel.core.scoring.ScoringService} – builds the
 * {@link com.correlationsentinel.core.model.Alert}</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.correlationsentinel.core.scoring;
