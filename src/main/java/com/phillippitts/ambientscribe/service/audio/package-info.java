/**
 * Canonical audio format, VAD framing and WAV export.
 *
 * <p>Everything downstream of the microphone works in one format: 16kHz, 16-bit signed PCM,
 * mono, little-endian.
 *
 * <p>Key Components:
 * <ul>
 *   <li>{@link com.phillippitts.ambientscribe.service.audio.AudioFormat} - Single source
 *       of truth for audio format constants and WAV header offsets</li>
 *   <li>{@link com.phillippitts.ambientscribe.service.audio.FrameAccumulator} - Slices the
 *       byte stream into fixed-duration frames with normalized RMS energy</li>
 *   <li>{@link com.phillippitts.ambientscribe.service.audio.WavWriter} - Wraps raw PCM
 *       bytes in a 44-byte RIFF/WAVE header</li>
 * </ul>
 *
 * <p>Usage Example:
 * <pre>
 * byte[] pcmData = engine.snapshotRetainedAudio();
 * byte[] wavData = WavWriter.toWav(pcmData);
 * </pre>
 *
 * @see com.phillippitts.ambientscribe.service.audio.capture
 * @since 1.0
 */
package com.phillippitts.ambientscribe.service.audio;
