/**
 * Templates, versions, the build pipeline with its retry and dead-letter ladder,
 * and release promotion.
 */
package com.ryuqq.controlplane.application.template;
