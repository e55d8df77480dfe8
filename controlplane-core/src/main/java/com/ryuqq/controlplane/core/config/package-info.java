/**
 * Immutable configuration records.
 */
package com.ryuqq.controlplane.core.config;
