/**
 * Build outcome types returned by {@link com.ryuqq.controlplane.core.builder.TemplateBuilder}.
 */
package com.ryuqq.controlplane.core.outcome;
