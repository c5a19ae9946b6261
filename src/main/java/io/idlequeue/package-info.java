/**
 * Idle-game task queue engine.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.idlequeue.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.idlequeue.cli.IdleQueueCommand} maps commands to runtime APIs.</li>
 *   <li>{@code io.idlequeue.engine.QueueScheduler} advances running queues one completion at a time.</li>
 *   <li>{@code io.idlequeue.sync.SyncProtocol} keeps every client connection of a player in step.</li>
 *   <li>{@code io.idlequeue.storage.TaskQueueStore} is the authoritative, versioned queue store.</li>
 * </ul>
 */
package io.idlequeue;
