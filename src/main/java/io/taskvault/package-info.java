/**
 * TaskVault source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.taskvault.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.taskvault.cli.TaskVaultCommand} maps commands to runtime APIs.</li>
 *   <li>{@code io.taskvault.runtime.TaskVaultRuntime} owns the components and timers of one storage root.</li>
 *   <li>{@code io.taskvault.storage.EncryptedStore} is the only code that touches document files.</li>
 * </ul>
 */
package io.taskvault;
