/**
 * HMAC-SHA256 payload signing and the {@code X-Signature} header contract.
 */
package io.hookbox.signature;
