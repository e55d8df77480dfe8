/**
 * In-memory job dispatch: a FIFO of build ids and a coalescing reconcile flag,
 * drained by the runner module's workers.
 */
package com.ryuqq.controlplane.adapter.inmemory.dispatch;
