/**
 * Background runners: the build queue worker and the reconcile scheduler.
 *
 * <p>Both drive application services from the in-memory job dispatcher and never touch
 * state directly.</p>
 */
package com.ryuqq.controlplane.adapter.runner;
