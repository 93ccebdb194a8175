/**
 * Event fan-out: subscription matching, the dedup window and canonical payload rendering.
 */
package io.hookbox.dispatch;
