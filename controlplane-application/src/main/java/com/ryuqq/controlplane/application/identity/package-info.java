/**
 * Identity and access: users, tokens, device codes, recovery codes, passkeys,
 * workspace memberships and invites.
 */
package com.ryuqq.controlplane.application.identity;
