/**
 * Session lifecycle: creation, start/stop/restart under the running-session quota,
 * deletion, snapshot restore records and session-bound runtime tokens.
 */
package com.ryuqq.controlplane.application.session;
