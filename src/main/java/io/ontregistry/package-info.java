/**
 * Nanopore experiment registry source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.ontregistry.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.ontregistry.cli.RegistryCommand} maps commands to runtime APIs.</li>
 *   <li>{@code io.ontregistry.registry.RecordStore} is the authoritative record store.</li>
 *   <li>{@code io.ontregistry.reconcile.ReconciliationEngine} diffs a discovery batch against the store.</li>
 *   <li>{@code io.ontregistry.proposal.ProposalManager} runs the approval lifecycle and applies proposals.</li>
 * </ul>
 */
package io.ontregistry;
