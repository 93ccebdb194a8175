/**
 * Database sweep that feeds due delivery records back into the work queue.
 */
package io.hookbox.poller;
