/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.shardwarden.master.reconcile;

import dev.mars.shardwarden.core.RegistryEntry;

import java.util.List;

/**
 * Outcome of one reconciliation pass. The entries listed have already been
 * mutated; the plan tells the caller whom to notify and what to mint.
 *
 * @param goal           partition count the pass reconciled against
 * @param assigned       entries given a new goal (workers and the master role)
 * @param retired        entries whose partition was withdrawn, with the reason
 * @param configuring    bound entries that have not yet reported their goal as current
 * @param unbound        partition ids still without a holder after assignment
 * @param workersToMint  number of new worker identities to create
 * @param mintMaster     whether a master-role identity must be created
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-06
 * @version 1.0
 */
public record ReconciliationPlan(
        int goal,
        List<RegistryEntry> assigned,
        List<Retirement> retired,
        List<RegistryEntry> configuring,
        List<Integer> unbound,
        int workersToMint,
        boolean mintMaster) {

    public enum Reason {
        /** Heartbeat age reached the expected-reboot threshold; the id is released. */
        DEAD,
        /** Heartbeat age reached the reboot-request threshold. */
        STALE,
        /** Another, more recently booted entry holds the same assignment. */
        DUPLICATE,
        /** The assignment no longer exists in the current layout. */
        SURPLUS,
        /** An extra master-role entry lost the role. */
        DEMOTED
    }

    public record Retirement(RegistryEntry entry, Reason reason) {
    }

    /**
     * Whether the persisted subset of any entry changed.
     */
    public boolean changed() {
        return !assigned.isEmpty() || !retired.isEmpty();
    }
}
