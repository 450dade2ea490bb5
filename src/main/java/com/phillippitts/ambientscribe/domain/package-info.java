/**
 * Immutable value types exchanged between the capture, diarization and quality stages.
 *
 * <p>Key types:
 * <ul>
 *   <li>{@link com.phillippitts.ambientscribe.domain.AudioFrame} - one VAD window of samples with energy</li>
 *   <li>{@link com.phillippitts.ambientscribe.domain.DiarizationAssignment} - speaker decision per qualifying frame</li>
 *   <li>{@link com.phillippitts.ambientscribe.domain.VadState} - latest voice-activity state</li>
 *   <li>{@link com.phillippitts.ambientscribe.domain.SpeakerRole} and
 *       {@link com.phillippitts.ambientscribe.domain.QualityLevel} - enumerations</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.ambientscribe.domain;
