/**
 * Energy-based two-speaker diarization and its quality self-assessment.
 *
 * <p>{@link com.phillippitts.ambientscribe.service.diarization.SpeakerDiarizer} assigns each
 * qualifying frame to one of two roles; {@link com.phillippitts.ambientscribe.service.diarization.DiarizationQualityEvaluator}
 * estimates a rolling DER and swap accuracy from those assignments and holds the fallback flag the
 * diarizer consults before every automatic decision.
 *
 * @since 1.0
 */
package com.phillippitts.ambientscribe.service.diarization;
