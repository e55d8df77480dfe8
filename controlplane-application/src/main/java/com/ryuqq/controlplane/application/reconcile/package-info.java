/**
 * Periodic reconciliation: stuck build recovery, build draining, idle session sleep
 * and garbage collection of deleted sessions, stale sleepers, expired grants and orphan snapshots.
 */
package com.ryuqq.controlplane.application.reconcile;
