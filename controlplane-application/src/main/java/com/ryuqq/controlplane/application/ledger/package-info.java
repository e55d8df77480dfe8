/**
 * Append-only usage and audit ledger plus its read models.
 */
package com.ryuqq.controlplane.application.ledger;
