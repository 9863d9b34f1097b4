/**
 * Rolling per-series statistics (count, mean, population standard deviation).
 *
 * @since 1.0.0
 */
package com.gsesentinel.core.stats;
