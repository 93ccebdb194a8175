/**
 * Event bus contract and the in-process reference implementation.
 */
package io.hookbox.bus;
