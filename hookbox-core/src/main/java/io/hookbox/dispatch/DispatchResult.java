package io.hookbox.dispatch;

/**
 * Per-event summary of a dispatch.
 *
 * @param matched      enabled subscriptions listening for the event
 * @param created      delivery records created
 * @param deduplicated subscriptions skipped by the dedup window
 * @param failed       subscriptions whose record could not be persisted
 */
public record DispatchResult(int matched, int created, int deduplicated, int failed) {

  static final DispatchResult NONE = new DispatchResult(0, 0, 0, 0);
}
