/**
 * Credit accounting around a run: the {@link com.flowmaestro.ledger.CreditLedger} collaborator
 * and the {@link com.flowmaestro.ledger.AdmissionGate} that holds, accumulates and settles
 * exactly once.
 */
package com.flowmaestro.ledger;
