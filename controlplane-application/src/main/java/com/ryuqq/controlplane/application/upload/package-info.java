/**
 * Snapshot and template bundle content: direct uploads with size ceilings,
 * single-use upload grants and downloads through the object store.
 */
package com.ryuqq.controlplane.application.upload;
