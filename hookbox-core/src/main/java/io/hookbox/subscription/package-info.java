/**
 * Subscription maintenance.
 */
package io.hookbox.subscription;
