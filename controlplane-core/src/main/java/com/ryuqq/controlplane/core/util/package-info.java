/**
 * JSON, identifier and hashing helpers shared by every module.
 */
package com.ryuqq.controlplane.core.util;
