/**
 * File-system adapters: a whole-document JSON backing store with atomic replace,
 * and a directory-per-kind object store.
 */
package com.ryuqq.controlplane.adapter.file;
