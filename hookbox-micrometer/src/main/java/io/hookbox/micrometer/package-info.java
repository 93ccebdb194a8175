/**
 * Micrometer bridge for hookbox metrics.
 */
package io.hookbox.micrometer;
