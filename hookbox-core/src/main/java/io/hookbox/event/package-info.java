/**
 * Domain events produced by the content engine and consumed by the webhook dispatcher.
 */
package io.hookbox.event;
