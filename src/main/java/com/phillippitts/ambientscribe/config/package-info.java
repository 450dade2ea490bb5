/**
 * Spring configuration: typed properties, thread pools, the microphone source bean and startup
 * sanity checks.
 *
 * @since 1.0
 */
package com.phillippitts.ambientscribe.config;
