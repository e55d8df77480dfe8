/**
 * Authentication, role checks and state lookups shared by the application services.
 */
package com.ryuqq.controlplane.application.support;
