/**
 * Error taxonomy shared by the access layer and the command tree.
 *
 * <p>Everything is unchecked. Validation failures are raised before any I/O and
 * are never retried; {@link io.didacli.error.NetworkException} and
 * {@link io.didacli.error.ApiException} come out of the transport after its
 * retry policy has run.
 */
package io.didacli.error;
