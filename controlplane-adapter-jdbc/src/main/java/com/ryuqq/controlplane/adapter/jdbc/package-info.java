/**
 * JDBC backing store that keeps each state collection in its own SQLite table.
 */
package com.ryuqq.controlplane.adapter.jdbc;
