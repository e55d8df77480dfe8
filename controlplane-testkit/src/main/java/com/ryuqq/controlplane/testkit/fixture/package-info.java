/**
 * Test fixtures: a controllable clock, a deterministic credential verifier and sample state documents.
 */
package com.ryuqq.controlplane.testkit.fixture;
