/**
 * Persistent data model: subscriptions, delivery records and dead letter entries.
 */
package io.hookbox.model;
