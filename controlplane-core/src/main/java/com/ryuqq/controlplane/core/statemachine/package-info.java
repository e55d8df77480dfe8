/**
 * Build and session state machines.
 *
 * <p>Transition validators throw {@link java.lang.IllegalStateException} for
 * transitions outside the allowed graph. Services translate that into a
 * conflict for callers.</p>
 */
package com.ryuqq.controlplane.core.statemachine;
