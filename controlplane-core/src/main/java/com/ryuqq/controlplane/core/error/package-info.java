/**
 * Domain error types raised by control plane operations.
 */
package com.ryuqq.controlplane.core.error;
