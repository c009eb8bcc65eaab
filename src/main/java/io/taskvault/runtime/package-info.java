/**
 * Application context and background timers.
 *
 * <p>{@link io.taskvault.runtime.TaskVaultRuntime} wires path, key, store, repository and backup
 * components for one storage root and owns the autosave and daily-reset executors.
 */
package io.taskvault.runtime;
