/**
 * Persistent entities of the control plane state document.
 *
 * <p>Entities are mutable beans so a transaction can edit its private draft in place.
 * They serialize through Jackson; enum values use lowercase wire names.</p>
 */
package com.ryuqq.controlplane.core.model;
