/**
 * Application services of the control plane, wired together by {@link com.ryuqq.controlplane.application.ControlPlane}.
 */
package com.ryuqq.controlplane.application;
