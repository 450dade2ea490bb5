/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.ambientscribe.exception.AmbientScribeException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.ambientscribe.exception.AudioSourceUnavailableException} - Thrown
 *       when the microphone cannot be opened (device missing, permission denied, unsupported format)</li>
 * </ul>
 *
 * <p>Read errors during a running session, timing anomalies and diarization quality problems are
 * recovered locally and reported through application events rather than exceptions.
 *
 * @see com.phillippitts.ambientscribe.exception.AmbientScribeException
 * @since 1.0
 */
package com.phillippitts.ambientscribe.exception;
